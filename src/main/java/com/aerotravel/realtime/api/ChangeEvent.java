package com.aerotravel.realtime.api;

import java.util.Objects;

/**
 * Row-change event filter carried by a {@link ChannelConfig}, and the event tag
 * carried by a {@link RowChangePayload}.
 *
 * <p>{@link #ALL} is a filter only; a delivered payload is always tagged
 * {@link #INSERT}, {@link #UPDATE} or {@link #DELETE}.</p>
 */
public enum ChangeEvent
{
    INSERT("INSERT"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),
    ALL("*");

    private final String wireValue;

    ChangeEvent(String wireValue)
    {
        this.wireValue = wireValue;
    }

    /**
     * The token used on the wire, {@code "*"} for {@link #ALL}.
     */
    public String wireValue()
    {
        return wireValue;
    }

    /**
     * Whether a payload tagged {@code delivered} passes this filter.
     */
    public boolean matches(ChangeEvent delivered)
    {
        Objects.requireNonNull(delivered, "delivered");
        return this == ALL || this == delivered;
    }

    public static ChangeEvent fromWire(String value)
    {
        Objects.requireNonNull(value, "value");
        for (ChangeEvent e : values()) {
            if (e.wireValue.equalsIgnoreCase(value)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown change event: " + value);
    }
}
