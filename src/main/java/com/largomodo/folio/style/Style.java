package com.largomodo.folio.style;

/**
 * One property override in a style chain.
 * <p>
 * The two flags are set by whatever realizes markup into styled content and are
 * only read when page styles are computed:
 * <ul>
 *   <li>{@code outside}: the style was not produced inside a show rule's output</li>
 *   <li>{@code liftable}: the style comes from a set rule rather than from
 *       arguments passed directly to one element</li>
 * </ul>
 *
 * @param key      the property
 * @param value    the new value, null meaning an explicit "none"
 * @param outside  whether the style is outside of any show rule
 * @param liftable whether the style may propagate to page level
 */
public record Style(StyleKey<?> key, Object value, boolean outside, boolean liftable) {

    public Style {
        if (key == null) {
            throw new IllegalArgumentException("Style key cannot be null");
        }
    }

    /**
     * A style from a set rule at document level.
     */
    public static <T> Style set(StyleKey<T> key, T value) {
        return new Style(key, value, true, true);
    }

    /**
     * A style from arguments given directly to one element.
     */
    public static <T> Style direct(StyleKey<T> key, T value) {
        return new Style(key, value, true, false);
    }

    /**
     * The same style, marked as coming from a show rule's output.
     */
    public Style inShowRule() {
        return new Style(key, value, false, liftable);
    }
}
