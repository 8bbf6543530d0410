package com.litscan.model.dto;

import com.litscan.model.enums.CertificateKind;

import java.util.List;

/**
 * 证书字段，实现只有 {@link PatentFields} 与 {@link SoftwareFields}
 *
 * @author litscan
 */
public interface CertificateFields {

    CertificateKind getKind();

    /**
     * 触发 OCR 补全时参与计数的缺失字段
     */
    List<String> missingFields();

    /**
     * 关键字段是否齐全，不齐全时记录需要复核
     */
    boolean isComplete();

    default int countMissing() {
        return missingFields().size();
    }
}
