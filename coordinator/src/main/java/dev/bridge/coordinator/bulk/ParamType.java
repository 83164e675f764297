package dev.bridge.coordinator.bulk;

public enum ParamType {
    STRING,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ANY
}
