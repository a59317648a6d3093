package au.org.ala.thumbor.command;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A filter invocation, rendered as {@code name(arg1,arg2,...)}.
 */
public final class Filter {

    private static final Joiner ARGUMENT_JOINER = Joiner.on(',');

    private final String name;
    private final List<FilterArgument> arguments;

    public Filter(String name, List<FilterArgument> arguments) {
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public static Filter of(String name, Object... args) {
        ImmutableList.Builder<FilterArgument> builder = ImmutableList.builder();
        for (Object arg : args) {
            builder.add(FilterArgument.ofObject(arg));
        }
        return new Filter(name, builder.build());
    }

    public String getName() { return name; }

    public List<FilterArgument> getArguments() { return arguments; }

    public String canonical() {
        return name + "(" + ARGUMENT_JOINER.join(arguments) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Filter)) return false;
        Filter filter = (Filter) o;
        return name.equals(filter.name) && arguments.equals(filter.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return canonical();
    }
}
