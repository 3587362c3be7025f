package io.batchconvert.core.engine;

import java.util.function.Predicate;

/**
 * How a job's output is produced, chosen from the shape of the request. The constants form a
 * decision table evaluated in declaration order: the first strategy whose condition holds wins,
 * and {@link #WHOLE_DOCUMENT} always applies.
 *
 * <table>
 * <caption>Precedence</caption>
 * <tr><th>#</th><th>Strategy</th><th>Condition</th></tr>
 * <tr><td>1</td><td>{@link #PER_PART}</td><td>output is templated</td></tr>
 * <tr><td>2</td><td>{@link #EXTENSION}</td><td>an extension is configured</td></tr>
 * <tr><td>3</td><td>{@link #NATIVE_SAVE}</td><td>output kind is the loader's native format</td></tr>
 * <tr><td>4</td><td>{@link #PAGE_BY_PAGE}</td><td>output kind is page-segmented</td></tr>
 * <tr><td>5</td><td>{@link #WHOLE_DOCUMENT}</td><td>always</td></tr>
 * </table>
 */
public enum ConversionStrategy {
    PER_PART(RequestShape::templated),
    EXTENSION(RequestShape::hasExtension),
    NATIVE_SAVE(RequestShape::nativeFormat),
    PAGE_BY_PAGE(RequestShape::pageSegmented),
    WHOLE_DOCUMENT(shape -> true);

    /** The request properties the decision is keyed on. */
    public record RequestShape(boolean templated, boolean hasExtension, boolean nativeFormat, boolean pageSegmented) {}

    private final Predicate<RequestShape> condition;

    ConversionStrategy(Predicate<RequestShape> condition) {
        this.condition = condition;
    }

    /** Returns {@code true} if this strategy's own condition holds, ignoring precedence. */
    public boolean appliesTo(RequestShape shape) {
        return condition.test(shape);
    }

    /**
     * Selects the strategy for a request.
     *
     * @param shape the request properties
     * @return the first applicable strategy in precedence order
     */
    public static ConversionStrategy select(RequestShape shape) {
        for (ConversionStrategy strategy : values()) {
            if (strategy.appliesTo(shape)) {
                return strategy;
            }
        }
        throw new IllegalStateException("unreachable: WHOLE_DOCUMENT always applies");
    }

    /** Convenience overload of {@link #select(RequestShape)}. */
    public static ConversionStrategy select(
            boolean templated, boolean hasExtension, boolean nativeFormat, boolean pageSegmented) {
        return select(new RequestShape(templated, hasExtension, nativeFormat, pageSegmented));
    }
}
