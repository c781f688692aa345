package com.questrail.gridcheck.api;

/**
 * The kind of structure a validator inspects. Used to tag observability
 * events so that a single sink can serve every validator.
 */
public enum ValidationSubject
{
    IPV4,
    SUDOKU
}
