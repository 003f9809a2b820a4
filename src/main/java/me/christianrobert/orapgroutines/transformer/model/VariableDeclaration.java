package me.christianrobert.orapgroutines.transformer.model;

import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;
import me.christianrobert.orapgroutines.transformer.model.token.SqlTokens;

import java.util.Collections;
import java.util.List;

/**
 * {@code name [CONSTANT] type [NOT NULL] [:= | DEFAULT expr];}
 */
public class VariableDeclaration extends Declaration {

    private final boolean constant;
    private final String dataType;
    private final boolean notNull;
    private final List<SqlToken> defaultTokens;

    public VariableDeclaration(String name, boolean constant, String dataType, boolean notNull,
                               List<SqlToken> defaultTokens, List<SqlToken> tokens) {
        super(name, tokens);
        this.constant = constant;
        this.dataType = dataType;
        this.notNull = notNull;
        this.defaultTokens = SqlTokens.immutableCopy(defaultTokens);
    }

    /**
     * Creates a declaration that does not come from source (shadow variables).
     */
    public static VariableDeclaration synthesized(String name, String dataType, String defaultValue) {
        List<SqlToken> defaults = defaultValue == null
                ? Collections.emptyList()
                : SqlTokens.synthesized(defaultValue);
        return new VariableDeclaration(name, false, dataType, false, defaults, Collections.emptyList());
    }

    public boolean isConstant() {
        return constant;
    }

    /** Oracle data type as written, e.g. {@code VARCHAR2(100)} or {@code emp.sal%TYPE} */
    public String getDataType() {
        return dataType;
    }

    public boolean isNotNull() {
        return notNull;
    }

    public List<SqlToken> getDefaultTokens() {
        return defaultTokens;
    }

    public boolean hasDefault() {
        return !defaultTokens.isEmpty();
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.VARIABLE;
    }

    @Override
    public String toString() {
        return "VariableDeclaration{" + getName() + " " + dataType + "}";
    }
}
