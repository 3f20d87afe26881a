package app.herbaria.provenance.domain.type;

public enum FlagSeverity {
    low,
    medium,
    high
}
