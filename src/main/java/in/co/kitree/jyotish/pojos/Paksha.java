package in.co.kitree.jyotish.pojos;

public enum Paksha {
    SHUKLA("Shukla"),
    KRISHNA("Krishna");

    private final String displayName;

    Paksha(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
