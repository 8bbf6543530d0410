package com.litscan.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @author litscan
 */
@Getter
@AllArgsConstructor
public enum CertificateKind {

    PATENT("patent"),
    SOFTWARE("software"),
    NEITHER("neither");

    private final String value;
}
