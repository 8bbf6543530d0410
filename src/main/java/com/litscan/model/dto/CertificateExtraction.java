package com.litscan.model.dto;

import com.litscan.model.enums.CertificateKind;
import com.litscan.model.enums.ExtractionMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 证书抽取结果
 *
 * @author litscan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CertificateExtraction {

    private CertificateKind kind;

    /**
     * kind 为 NEITHER 时为 null
     */
    private CertificateFields fields;

    private ExtractionMethod extractionMethod;

    private String rawText;

    /**
     * OCR 补全填充的字段
     */
    private List<String> ocrFilledFields;

    public PatentFields getPatentFields() {
        return fields instanceof PatentFields ? (PatentFields) fields : null;
    }

    public SoftwareFields getSoftwareFields() {
        return fields instanceof SoftwareFields ? (SoftwareFields) fields : null;
    }
}
