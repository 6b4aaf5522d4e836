package com.example.statements.domain.model;

/**
 * How the {@code statement_filename} of a success payload is chosen.
 */
public enum FilenameStrategy {
    /** Source filename without its directory part. */
    SOURCE,
    /** {@code <last four account digits>-<MM>-<YYYY>.pdf}, using the statement date. */
    ACCOUNT_MONTH_YEAR
}
