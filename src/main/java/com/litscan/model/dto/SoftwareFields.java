package com.litscan.model.dto;

import com.litscan.model.enums.CertificateKind;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 软件著作权登记证书字段
 *
 * @author litscan
 */
@Data
public class SoftwareFields implements CertificateFields {

    private String softwareName;

    private String version;

    private String registrationNumber;

    private String copyrightHolder;

    private String developmentDate;

    @Override
    public CertificateKind getKind() {
        return CertificateKind.SOFTWARE;
    }

    @Override
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (softwareName == null) {
            missing.add("software_name");
        }
        if (registrationNumber == null) {
            missing.add("registration_number");
        }
        if (copyrightHolder == null) {
            missing.add("copyright_holder");
        }
        if (developmentDate == null) {
            missing.add("development_date");
        }
        if (version == null) {
            missing.add("version");
        }
        return missing;
    }

    @Override
    public boolean isComplete() {
        return softwareName != null && registrationNumber != null && copyrightHolder != null && developmentDate != null;
    }

    public List<String> fillMissingFrom(SoftwareFields other) {
        List<String> filled = new ArrayList<>();
        if (softwareName == null && other.softwareName != null) {
            softwareName = other.softwareName;
            filled.add("software_name");
        }
        if (registrationNumber == null && other.registrationNumber != null) {
            registrationNumber = other.registrationNumber;
            filled.add("registration_number");
        }
        if (copyrightHolder == null && other.copyrightHolder != null) {
            copyrightHolder = other.copyrightHolder;
            filled.add("copyright_holder");
        }
        if (developmentDate == null && other.developmentDate != null) {
            developmentDate = other.developmentDate;
            filled.add("development_date");
        }
        if (version == null && other.version != null) {
            version = other.version;
            filled.add("version");
        }
        return filled;
    }
}
