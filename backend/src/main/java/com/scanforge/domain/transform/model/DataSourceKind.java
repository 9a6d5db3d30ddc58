package com.scanforge.domain.transform.model;

public enum DataSourceKind {
    POLYGON_API,
    FILE,
    HARDCODED,
    UNKNOWN
}
