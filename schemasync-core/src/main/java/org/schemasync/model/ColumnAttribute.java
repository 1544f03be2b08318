package org.schemasync.model;

/**
 * Column attributes compared independently by the column differ.
 */
public enum ColumnAttribute {
    TYPE, NULLABLE, DEFAULT, COMMENT
}
