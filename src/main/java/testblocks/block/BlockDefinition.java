package testblocks.block;

import testblocks.engine.ConfigurationException;
import testblocks.model.TypeKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Registration-time contract of a block type: how to construct it, which
 * properties to inject, and its single entry point with the parameter keys
 * that entry point requires.
 *
 * <p>Example:
 * <pre>{@code
 * BlockDefinition<LogIn> logIn = BlockDefinition.builder("LogIn", LogIn::new)
 *         .property("browser", TypeKey.of(Browser.class), LogIn::setBrowser)
 *         .executes(TypeKey.of(HomePage.class), TypeKey.of(Credentials.class), LogIn::logIn)
 *         .build();
 * }</pre>
 *
 * <p>Definitions are immutable and may be shared between pipelines.
 */
public final class BlockDefinition<B> {

    private final String                      name;
    private final List<TypeKey<?>>            constructorParameters;
    private final Factory<B>                  factory;
    private final List<PropertyBinding<B, ?>> properties;
    private final List<TypeKey<?>>            parameters;
    private final TypeKey<?>                  outputKey;
    private final EntryPoint<B>               entryPoint;

    private BlockDefinition(Builder<B> b) {
        this.name                  = b.name;
        this.constructorParameters = Collections.unmodifiableList(new ArrayList<>(b.constructorParameters));
        this.factory               = b.factory;
        this.properties            = Collections.unmodifiableList(new ArrayList<>(b.properties));
        this.parameters            = Collections.unmodifiableList(new ArrayList<>(b.parameters));
        this.outputKey             = b.outputKey;
        this.entryPoint            = b.entryPoint;
    }

    // ── Builders ──────────────────────────────────────────────────────────

    public static <B> Builder<B> builder(String name, Supplier<B> constructor) {
        Objects.requireNonNull(constructor, "constructor");
        return new Builder<>(name, List.of(), args -> constructor.get());
    }

    public static <B, A> Builder<B> builder(String name, TypeKey<A> dependency,
                                            Function<A, B> constructor) {
        Objects.requireNonNull(constructor, "constructor");
        return new Builder<>(name, List.of(dependency),
                args -> constructor.apply(dependency.cast(args[0])));
    }

    public static <B, A1, A2> Builder<B> builder(String name, TypeKey<A1> first, TypeKey<A2> second,
                                                 BiFunction<A1, A2, B> constructor) {
        Objects.requireNonNull(constructor, "constructor");
        return new Builder<>(name, List.of(first, second),
                args -> constructor.apply(first.cast(args[0]), second.cast(args[1])));
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public String                      getName()                  { return name; }
    public List<TypeKey<?>>            getConstructorParameters() { return constructorParameters; }
    public List<PropertyBinding<B, ?>> getProperties()            { return properties; }
    public List<TypeKey<?>>            getParameters()            { return parameters; }

    /** Key the entry point's result is stored under; null means "the value's runtime class". */
    public TypeKey<?> getOutputKey() { return outputKey; }

    public int getParameterCount() { return parameters.size(); }

    /** Constructs a block instance from resolved constructor arguments. */
    public B instantiate(Object[] constructorArgs) throws Exception {
        return factory.create(constructorArgs);
    }

    /** Calls the entry point. Exceptions raised by the block body are not wrapped. */
    public Object invoke(B block, Object[] args) throws Exception {
        return entryPoint.invoke(block, args);
    }

    @Override
    public String toString() {
        return String.format("BlockDefinition{name='%s', parameters=%s, output=%s}",
                name, parameters, outputKey);
    }

    /** Creates a block instance from positional constructor arguments. */
    @FunctionalInterface
    interface Factory<B> {
        B create(Object[] args) throws Exception;
    }

    // ── Builder ───────────────────────────────────────────────────────────

    /**
     * Accumulates a block's contract. {@link #build()} requires exactly one
     * entry point to have been declared.
     */
    public static final class Builder<B> {

        private final String                      name;
        private final List<TypeKey<?>>            constructorParameters;
        private final Factory<B>                  factory;
        private final List<PropertyBinding<B, ?>> properties   = new ArrayList<>();
        private final Set<String>                 propertyNames = new HashSet<>();

        private List<TypeKey<?>> parameters = List.of();
        private TypeKey<?>       outputKey;
        private EntryPoint<B>    entryPoint;
        private int              entryPointCount;

        private Builder(String name, List<TypeKey<?>> constructorParameters, Factory<B> factory) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Test block name must not be blank");
            }
            for (TypeKey<?> key : constructorParameters) {
                Objects.requireNonNull(key, "constructor parameter key");
            }
            this.name                  = name;
            this.constructorParameters = constructorParameters;
            this.factory               = factory;
        }

        // ── Properties ───────────────────────────────────────────────────

        public <T> Builder<B> property(String propertyName, TypeKey<T> key, BiConsumer<B, T> setter) {
            return addProperty(new PropertyBinding<>(propertyName, key,
                    Objects.requireNonNull(setter, "setter"), null));
        }

        public <T> Builder<B> property(String propertyName, TypeKey<T> key,
                                       BiConsumer<B, T> setter, Function<B, T> getter) {
            return addProperty(new PropertyBinding<>(propertyName, key,
                    Objects.requireNonNull(setter, "setter"), getter));
        }

        /** A property that is logged but never injected. */
        public <T> Builder<B> readOnlyProperty(String propertyName, TypeKey<T> key, Function<B, T> getter) {
            return addProperty(new PropertyBinding<>(propertyName, key, null,
                    Objects.requireNonNull(getter, "getter")));
        }

        private Builder<B> addProperty(PropertyBinding<B, ?> binding) {
            Objects.requireNonNull(binding.getKey(), "property key");
            if (!propertyNames.add(binding.getName())) {
                throw new ConfigurationException("Test block '" + name
                        + "' declares property '" + binding.getName() + "' more than once");
            }
            properties.add(binding);
            return this;
        }

        // ── Value-returning entry points ─────────────────────────────────

        public <R> Builder<B> executes(TypeKey<R> output, EntryPoint.Returning0<B, R> fn) {
            Objects.requireNonNull(fn, "entry point");
            return entryPoint(List.of(), output, (block, args) -> fn.invoke(block));
        }

        public <R, A> Builder<B> executes(TypeKey<R> output, TypeKey<A> p1,
                                          EntryPoint.Returning1<B, A, R> fn) {
            Objects.requireNonNull(fn, "entry point");
            return entryPoint(List.of(p1), output,
                    (block, args) -> fn.invoke(block, p1.cast(args[0])));
        }

        public <R, A1, A2> Builder<B> executes(TypeKey<R> output, TypeKey<A1> p1, TypeKey<A2> p2,
                                               EntryPoint.Returning2<B, A1, A2, R> fn) {
            Objects.requireNonNull(fn, "entry point");
            return entryPoint(List.of(p1, p2), output,
                    (block, args) -> fn.invoke(block, p1.cast(args[0]), p2.cast(args[1])));
        }

        public <R, A1, A2, A3> Builder<B> executes(TypeKey<R> output, TypeKey<A1> p1, TypeKey<A2> p2,
                                                   TypeKey<A3> p3,
                                                   EntryPoint.Returning3<B, A1, A2, A3, R> fn) {
            Objects.requireNonNull(fn, "entry point");
            return entryPoint(List.of(p1, p2, p3), output,
                    (block, args) -> fn.invoke(block,
                            p1.cast(args[0]), p2.cast(args[1]), p3.cast(args[2])));
        }

        // ── Void entry points ─────────────────────────────────────────────

        public Builder<B> runs(EntryPoint.Void0<B> fn) {
            Objects.requireNonNull(fn, "entry point");
            return entryPoint(List.of(), null, (block, args) -> {
                fn.invoke(block);
                return null;
            });
        }

        public <A> Builder<B> runs(TypeKey<A> p1, EntryPoint.Void1<B, A> fn) {
            Objects.requireNonNull(fn, "entry point");
            return entryPoint(List.of(p1), null, (block, args) -> {
                fn.invoke(block, p1.cast(args[0]));
                return null;
            });
        }

        public <A1, A2> Builder<B> runs(TypeKey<A1> p1, TypeKey<A2> p2, EntryPoint.Void2<B, A1, A2> fn) {
            Objects.requireNonNull(fn, "entry point");
            return entryPoint(List.of(p1, p2), null, (block, args) -> {
                fn.invoke(block, p1.cast(args[0]), p2.cast(args[1]));
                return null;
            });
        }

        public <A1, A2, A3> Builder<B> runs(TypeKey<A1> p1, TypeKey<A2> p2, TypeKey<A3> p3,
                                            EntryPoint.Void3<B, A1, A2, A3> fn) {
            Objects.requireNonNull(fn, "entry point");
            return entryPoint(List.of(p1, p2, p3), null, (block, args) -> {
                fn.invoke(block, p1.cast(args[0]), p2.cast(args[1]), p3.cast(args[2]));
                return null;
            });
        }

        // ── Untyped entry point ───────────────────────────────────────────

        /**
         * Declares an entry point with any number of parameters.
         *
         * @param output key for the result, or {@code null} to key non-null
         *               results by their runtime class
         */
        public Builder<B> entryPoint(List<TypeKey<?>> parameterKeys, TypeKey<?> output, EntryPoint<B> fn) {
            Objects.requireNonNull(parameterKeys, "parameterKeys");
            Objects.requireNonNull(fn, "entry point");
            for (TypeKey<?> key : parameterKeys) {
                Objects.requireNonNull(key, "parameter key");
            }
            entryPointCount++;
            this.parameters = List.copyOf(parameterKeys);
            this.outputKey  = output;
            this.entryPoint = fn;
            return this;
        }

        /**
         * @throws ConfigurationException if no entry point, or more than one,
         *                                was declared
         */
        public BlockDefinition<B> build() {
            if (entryPointCount == 0) {
                throw new ConfigurationException("Test block '" + name
                        + "' declares no entry point; exactly one is required");
            }
            if (entryPointCount > 1) {
                throw new ConfigurationException("Test block '" + name + "' declares "
                        + entryPointCount + " entry points; exactly one is required");
            }
            return new BlockDefinition<>(this);
        }
    }
}
