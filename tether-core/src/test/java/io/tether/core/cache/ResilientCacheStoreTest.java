package io.tether.core.cache;

import io.tether.core.circuit.CircuitBreaker;
import io.tether.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ResilientCacheStore")
class ResilientCacheStoreTest {

    private static final CacheEntryOptions OPTIONS = CacheEntryOptions.expireAfter(Duration.ofMinutes(1));

    @Mock
    private CacheStore backend;

    private MutableClock clock;
    private CircuitBreaker breaker;
    private ResilientCacheStore store;

    @BeforeEach
    void setUp() {
        when(backend.name()).thenReturn("remote");
        clock = MutableClock.startingNow();
        breaker = CircuitBreaker.builder()
                .name("remote-store")
                .failureThreshold(2)
                .halfOpenSuccessThreshold(1)
                .resetTimeout(Duration.ofSeconds(30))
                .clock(clock)
                .build();
        store = new ResilientCacheStore(backend, breaker);
    }

    @Test
    @DisplayName("should pass calls through while the backend is healthy")
    void shouldPassThrough() {
        when(backend.get("quote")).thenReturn(Optional.of(42));

        assertThat(store.get("quote")).contains(42);
        store.set("quote", 43, OPTIONS);
        store.remove("quote");

        verify(backend).set("quote", 43, OPTIONS);
        verify(backend).remove("quote");
        assertThat(store.name()).isEqualTo("remote");
    }

    @Test
    @DisplayName("should report a failing read as a miss")
    void shouldDegradeReadToMiss() {
        when(backend.get(anyString())).thenThrow(new IllegalStateException("connection reset"));

        assertThat(store.get("quote")).isEmpty();
        assertThat(breaker.getFailureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should skip a failing write")
    void shouldSkipFailingWrite() {
        doThrow(new IllegalStateException("read-only replica"))
                .when(backend).set(anyString(), any(), any(CacheEntryOptions.class));

        assertThatCode(() -> store.set("quote", 42, OPTIONS)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should stop calling the backend once the circuit opens")
    void shouldShortCircuit() {
        when(backend.get(anyString())).thenThrow(new IllegalStateException("connection reset"));
        store.get("a");
        store.get("b");
        assertThat(breaker.isOpen()).isTrue();

        assertThat(store.get("c")).isEmpty();
        assertThat(store.contains("c")).isFalse();

        verify(backend, times(2)).get(anyString());
        verify(backend, never()).contains(anyString());
    }

    @Test
    @DisplayName("should recover after the reset timeout")
    void shouldRecover() {
        when(backend.get(anyString()))
                .thenThrow(new IllegalStateException("down"))
                .thenThrow(new IllegalStateException("down"))
                .thenReturn(Optional.of(42));
        store.get("a");
        store.get("b");

        clock.advance(Duration.ofSeconds(31));

        assertThat(store.get("quote")).contains(42);
        assertThat(breaker.isClosed()).isTrue();
    }

    @Test
    @DisplayName("should name its default circuit after the backend")
    void shouldCreateDefaultBreaker() {
        ResilientCacheStore withDefaults = new ResilientCacheStore(backend);

        assertThat(withDefaults.getCircuitBreaker().getName()).isEqualTo("cache-store:remote");
        assertThat(withDefaults.getCircuitBreaker().isClosed()).isTrue();
    }
}
