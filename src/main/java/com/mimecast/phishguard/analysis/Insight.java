package com.mimecast.phishguard.analysis;

/**
 * Feature level explanation record.
 *
 * <p>The weight is advisory display information in [0, 1] and never feeds back into the score.
 */
public class Insight {
    private final String name;
    private final int value;
    private final Double weight;
    private final String description;

    /**
     * Constructs a new Insight instance.
     *
     * @param name        Insight name.
     * @param value       Count or 0/1 flag.
     * @param weight      Advisory weight, null for none.
     * @param description Description, null for none.
     */
    public Insight(InsightName name, int value, Double weight, String description) {
        this.name = name.getKey();
        this.value = value;
        this.weight = weight != null ? Math.max(0.0, Math.min(1.0, weight)) : null;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public int getValue() {
        return value;
    }

    public Double getWeight() {
        return weight;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "Insight{" +
                "name='" + name + '\'' +
                ", value=" + value +
                ", weight=" + weight +
                '}';
    }
}
