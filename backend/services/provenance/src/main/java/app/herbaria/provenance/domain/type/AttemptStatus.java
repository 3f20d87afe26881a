package app.herbaria.provenance.domain.type;

public enum AttemptStatus {
    pending,
    complete,
    failed;

    public boolean isTerminal() {
        return this != pending;
    }
}
