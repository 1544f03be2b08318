package org.schemasync.script.contributor;

/**
 * Marker for contributors rendered between the parentheses of a {@code CREATE TABLE}.
 */
public interface TableBodyContributor extends DdlContributor {
}
