package com.formulagrid.app.models;

/**
 * Maps the qualifier of an external reference ("t2" in "t2!A1", or a sheet name)
 * to a table that is already in memory.
 */
public interface TableResolver {

    /**
     * @return the table with this id, else the table with this name, else null
     */
    Table findTable(String idOrName);
}
