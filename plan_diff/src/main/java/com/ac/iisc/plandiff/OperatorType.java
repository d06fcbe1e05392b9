package com.ac.iisc.plandiff;

/**
 * Closed taxonomy of physical operators recognised in an EXPLAIN report.
 *
 * Anything the classifier cannot place (new operator names introduced by a
 * later server version, aggregations, sorts, ...) is {@link #UNKNOWN}.
 */
public enum OperatorType
{
    UNKNOWN,
    HASH_JOIN,
    INDEX_JOIN,
    MERGE_JOIN,
    SELECTION,
    PROJECTION,
    TABLE_READER,
    TABLE_SCAN,
    INDEX_READER,
    INDEX_SCAN,
    INDEX_LOOKUP,
    POINT_GET;

    /** True for the three join variants, which carry a {@link JoinType}. */
    public boolean isJoin() {
        return this == HASH_JOIN || this == INDEX_JOIN || this == MERGE_JOIN;
    }
}
