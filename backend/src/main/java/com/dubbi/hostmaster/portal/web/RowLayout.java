package com.dubbi.hostmaster.portal.web;

/**
 * How listing cells are assigned to schema columns.
 */
public enum RowLayout {
    /** running counter over the filtered cell stream, wrapping at the schema width */
    CELL_STREAM,
    /** the cell's index inside its own row selects the column */
    CELL_POSITION
}
