package me.christianrobert.orapgroutines.core.job.model.routine;

/**
 * Source text of one Oracle package as submitted for translation.
 * Schema and name may be left empty when the source carries a CREATE PACKAGE header.
 */
public class PackageSource {
    private String schema;
    private String packageName;
    private String specSql;
    private String bodySql;

    public PackageSource() {
    }

    public PackageSource(String schema, String packageName, String specSql, String bodySql) {
        this.schema = schema;
        this.packageName = packageName;
        this.specSql = specSql;
        this.bodySql = bodySql;
    }

    public String getSchema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    public String getPackageName() {
        return packageName;
    }

    public void setPackageName(String packageName) {
        this.packageName = packageName;
    }

    public String getSpecSql() {
        return specSql;
    }

    public void setSpecSql(String specSql) {
        this.specSql = specSql;
    }

    public String getBodySql() {
        return bodySql;
    }

    public void setBodySql(String bodySql) {
        this.bodySql = bodySql;
    }

    /**
     * Name used in logs and failure reports before the package is parsed.
     */
    public String getDisplayName() {
        String name = packageName != null && !packageName.isBlank() ? packageName : "<from header>";
        return schema != null && !schema.isBlank() ? schema + "." + name : name;
    }

    @Override
    public String toString() {
        return "PackageSource{" + getDisplayName()
                + ", spec=" + (specSql == null ? 0 : specSql.length()) + " chars"
                + ", body=" + (bodySql == null ? 0 : bodySql.length()) + " chars}";
    }
}
