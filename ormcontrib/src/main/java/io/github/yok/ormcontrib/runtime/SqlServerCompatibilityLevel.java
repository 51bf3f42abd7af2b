package io.github.yok.ormcontrib.runtime;

/**
 * SQL dialect level the SQL Server query engine generates for.
 *
 * @author Yasuharu.Okawauchi
 */
public enum SqlServerCompatibilityLevel {
    SQL_SERVER_2005, SQL_SERVER_2008, SQL_SERVER_2012, SQL_SERVER_2016
}
