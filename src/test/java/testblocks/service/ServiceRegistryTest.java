package testblocks.service;

import testblocks.model.TypeKey;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ServiceRegistryTest {

    interface Clock {}

    public static class SystemClock implements Clock {}

    static class NoDefaultConstructor implements Clock {
        NoDefaultConstructor(String ignored) {}
    }

    static class Tracked implements AutoCloseable {
        private final String       name;
        private final List<String> closed;

        Tracked(String name, List<String> closed) {
            this.name   = name;
            this.closed = closed;
        }

        @Override
        public void close() {
            closed.add(name);
        }
    }

    private static final TypeKey<Clock>   CLOCK   = TypeKey.of(Clock.class);
    private static final TypeKey<Tracked> TRACKED = TypeKey.of(Tracked.class);

    // ── Registration ──────────────────────────────────────────────────────

    @Test(description = "Registering the same key twice keeps only the last registration")
    public void register_sameKey_lastWins() {
        ServiceRegistry registry = new ServiceRegistry();
        Clock first  = new SystemClock();
        Clock second = new SystemClock();

        registry.registerInstance(CLOCK, first);
        registry.registerInstance(CLOCK, second);

        assertThat(registry.getRegisteredKeys()).containsExactly(CLOCK);
        assertThat(registry.createScope("run").get(CLOCK)).isSameAs(second);
    }

    @Test
    public void registerInstance_wrongType_throws() {
        ServiceRegistry registry = new ServiceRegistry();
        @SuppressWarnings({"unchecked", "rawtypes"})
        TypeKey<Object> key = (TypeKey) TypeKey.of(Integer.class);

        assertThatThrownBy(() -> registry.registerInstance(key, "not a number"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void lookup_isByExactKey() {
        ServiceRegistry registry = new ServiceRegistry();
        registry.registerType(TypeKey.of(SystemClock.class), Lifetime.SINGLETON, SystemClock.class);

        assertThat(registry.isRegistered(TypeKey.of(SystemClock.class))).isTrue();
        assertThat(registry.isRegistered(CLOCK)).isFalse();
        assertThat(registry.createScope("run").find(CLOCK)).isEmpty();
    }

    // ── Singletons ────────────────────────────────────────────────────────

    @Test(description = "A singleton is created once and shared by every scope")
    public void singleton_sharedAcrossScopes() {
        ServiceRegistry registry = new ServiceRegistry();
        AtomicInteger created = new AtomicInteger();
        registry.registerFactory(CLOCK, Lifetime.SINGLETON, scope -> {
            created.incrementAndGet();
            return new SystemClock();
        });

        Clock a = registry.createScope("run-1").get(CLOCK);
        Clock b = registry.createScope("run-2").get(CLOCK);

        assertThat(a).isSameAs(b);
        assertThat(created).hasValue(1);
    }

    @Test
    public void registerType_buildsThroughNoArgConstructor() {
        ServiceRegistry registry = new ServiceRegistry();
        registry.registerType(CLOCK, Lifetime.SCOPED, SystemClock.class);

        assertThat(registry.createScope("run").get(CLOCK)).isInstanceOf(SystemClock.class);
    }

    @Test
    public void registerType_withoutPublicNoArgConstructor_failsOnUse() {
        ServiceRegistry registry = new ServiceRegistry();
        registry.registerType(CLOCK, Lifetime.SCOPED, NoDefaultConstructor.class);

        assertThatThrownBy(() -> registry.createScope("run").get(CLOCK))
                .isInstanceOf(ServiceException.class)
                .hasMessageContaining("no public no-argument constructor");
    }

    @Test(description = "Replacing a singleton entry hands out the new provider's instance")
    public void register_afterSingletonCreated_replacesInstance() {
        ServiceRegistry registry = new ServiceRegistry();
        registry.registerFactory(CLOCK, Lifetime.SINGLETON, scope -> new SystemClock());
        Clock before = registry.createScope("run-1").get(CLOCK);

        Clock replacement = new SystemClock();
        registry.registerInstance(CLOCK, replacement);

        assertThat(registry.createScope("run-2").get(CLOCK))
                .isSameAs(replacement)
                .isNotSameAs(before);
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    @Test(description = "close() disposes created singletons newest first, but not caller-supplied instances")
    public void close_disposesOwnedSingletonsOnly() {
        List<String> closed = new ArrayList<>();
        ServiceRegistry registry = new ServiceRegistry();
        TypeKey<Tracked> first  = TypeKey.named(Tracked.class, "first");
        TypeKey<Tracked> second = TypeKey.named(Tracked.class, "second");
        registry.registerFactory(first, Lifetime.SINGLETON, scope -> new Tracked("first", closed));
        registry.registerFactory(second, Lifetime.SINGLETON, scope -> new Tracked("second", closed));
        registry.registerInstance(TRACKED, new Tracked("supplied", closed));

        ServiceScope scope = registry.createScope("run");
        scope.get(first);
        scope.get(second);
        scope.get(TRACKED);
        scope.dispose();
        assertThat(closed).as("singletons survive scope disposal").isEmpty();

        registry.close();
        assertThat(closed).containsExactly("second", "first");
    }

    @Test
    public void closedRegistry_rejectsNewScopes() {
        ServiceRegistry registry = new ServiceRegistry();
        registry.close();

        assertThatThrownBy(() -> registry.createScope("run"))
                .isInstanceOf(IllegalStateException.class);
    }
}
