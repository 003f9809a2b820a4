package me.christianrobert.orapgroutines.transformer.model;

/**
 * Oracle parameter modes and their PostgreSQL spelling.
 */
public enum ParameterMode {
    IN("IN"),
    OUT("OUT"),
    IN_OUT("INOUT");

    private final String postgresKeyword;

    ParameterMode(String postgresKeyword) {
        this.postgresKeyword = postgresKeyword;
    }

    public String getPostgresKeyword() {
        return postgresKeyword;
    }
}
