package com.scanforge.domain.transform.model;

/**
 * Where the input script gets its market data from.
 *
 * @param primarySource       dominant data source
 * @param usesPolygon         HTTP calls or polygon.io URLs were found
 * @param readsFiles          file reads (open, read_csv, ...) were found
 * @param hasHardcodedSymbols a literal list of 3+ strings was found
 */
public record DataSourceFlags(
        DataSourceKind primarySource,
        boolean usesPolygon,
        boolean readsFiles,
        boolean hasHardcodedSymbols
) {
    public static DataSourceFlags of(boolean usesPolygon, boolean readsFiles, boolean hasHardcodedSymbols) {
        DataSourceKind primary;
        if (usesPolygon) {
            primary = DataSourceKind.POLYGON_API;
        } else if (readsFiles) {
            primary = DataSourceKind.FILE;
        } else if (hasHardcodedSymbols) {
            primary = DataSourceKind.HARDCODED;
        } else {
            primary = DataSourceKind.UNKNOWN;
        }
        return new DataSourceFlags(primary, usesPolygon, readsFiles, hasHardcodedSymbols);
    }
}
