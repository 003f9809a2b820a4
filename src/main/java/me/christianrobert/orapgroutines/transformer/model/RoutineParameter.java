package me.christianrobert.orapgroutines.transformer.model;

/**
 * A routine or cursor parameter.
 */
public class RoutineParameter {

    private final String name;
    private final ParameterMode mode;
    private final String dataType;
    private final String defaultValue;

    public RoutineParameter(String name, ParameterMode mode, String dataType, String defaultValue) {
        this.name = name;
        this.mode = mode != null ? mode : ParameterMode.IN;
        this.dataType = dataType;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public ParameterMode getMode() {
        return mode;
    }

    /** Oracle data type as written */
    public String getDataType() {
        return dataType;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return name + " " + mode + " " + dataType;
    }
}
