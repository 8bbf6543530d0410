package com.litscan.model.dto;

import com.litscan.model.enums.CertificateKind;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 专利证书字段
 *
 * @author litscan
 */
@Data
public class PatentFields implements CertificateFields {

    public static final String DEFAULT_TYPE = "发明";

    private String patentNumber;

    private String grantNumber;

    private String title;

    /**
     * 分号分隔
     */
    private String inventors;

    private String patentee;

    private String applicationDate;

    private String grantDate;

    /**
     * 发明 / 实用新型 / 外观设计
     */
    private String patentType = DEFAULT_TYPE;

    @Override
    public CertificateKind getKind() {
        return CertificateKind.PATENT;
    }

    @Override
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (patentNumber == null) {
            missing.add("patent_number");
        }
        if (title == null) {
            missing.add("title");
        }
        if (inventors == null) {
            missing.add("inventors");
        }
        if (patentee == null) {
            missing.add("patentee");
        }
        if (grantNumber == null) {
            missing.add("grant_number");
        }
        if (applicationDate == null) {
            missing.add("application_date");
        }
        if (grantDate == null) {
            missing.add("grant_date");
        }
        return missing;
    }

    @Override
    public boolean isComplete() {
        return patentNumber != null && title != null && inventors != null && patentee != null;
    }

    /**
     * 只填充缺失字段，返回被填充的字段名
     */
    public List<String> fillMissingFrom(PatentFields other) {
        List<String> filled = new ArrayList<>();
        if (patentNumber == null && other.patentNumber != null) {
            patentNumber = other.patentNumber;
            filled.add("patent_number");
        }
        if (title == null && other.title != null) {
            title = other.title;
            filled.add("title");
        }
        if (inventors == null && other.inventors != null) {
            inventors = other.inventors;
            filled.add("inventors");
        }
        if (patentee == null && other.patentee != null) {
            patentee = other.patentee;
            filled.add("patentee");
        }
        if (grantNumber == null && other.grantNumber != null) {
            grantNumber = other.grantNumber;
            filled.add("grant_number");
        }
        if (applicationDate == null && other.applicationDate != null) {
            applicationDate = other.applicationDate;
            filled.add("application_date");
        }
        if (grantDate == null && other.grantDate != null) {
            grantDate = other.grantDate;
            filled.add("grant_date");
        }
        return filled;
    }
}
