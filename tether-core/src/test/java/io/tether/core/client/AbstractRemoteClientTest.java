package io.tether.core.client;

import io.tether.core.fault.ConnectivityException;
import io.tether.core.support.SimulatedRemoteClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AbstractRemoteClient")
class AbstractRemoteClientTest {

    // ========================================================================
    // OPEN
    // ========================================================================

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        @DisplayName("should move CREATED to OPENED on a successful handshake")
        void shouldOpen() {
            SimulatedRemoteClient client = new SimulatedRemoteClient();
            assertThat(client.state()).isEqualTo(ConnectionState.CREATED);

            client.open().toCompletableFuture().join();

            assertThat(client.state()).isEqualTo(ConnectionState.OPENED);
            assertThat(client.openCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("should be OPENING while the handshake is in flight")
        void shouldBeOpeningDuringHandshake() {
            SimulatedRemoteClient client = new SimulatedRemoteClient().delayOpen(Duration.ofMillis(200));

            CompletableFuture<Void> opened = client.open().toCompletableFuture();

            assertThat(client.state()).isEqualTo(ConnectionState.OPENING);
            opened.join();
            assertThat(client.state()).isEqualTo(ConnectionState.OPENED);
        }

        @Test
        @DisplayName("should fault when the handshake fails")
        void shouldFaultOnHandshakeFailure() {
            ConnectivityException refused = new ConnectivityException("connection refused");
            SimulatedRemoteClient client = new SimulatedRemoteClient().failOpenWith(refused);

            Throwable thrown = catchThrowable(() -> client.open().toCompletableFuture().join());

            assertThat(thrown).hasCause(refused);
            assertThat(client.state()).isEqualTo(ConnectionState.FAULTED);
        }

        @Test
        @DisplayName("should reject a second open")
        void shouldRejectSecondOpen() {
            SimulatedRemoteClient client = new SimulatedRemoteClient();
            client.open().toCompletableFuture().join();

            assertThatThrownBy(client::open)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("OPENED");
        }

        @Test
        @DisplayName("should not reach OPENED when aborted mid-handshake")
        void shouldStayClosedWhenAbortedMidHandshake() {
            SimulatedRemoteClient client = new SimulatedRemoteClient().delayOpen(Duration.ofMillis(100));
            CompletableFuture<Void> opened = client.open().toCompletableFuture();

            client.abort();

            assertThatThrownBy(opened::join).hasCauseInstanceOf(IllegalStateException.class);
            assertThat(client.state()).isEqualTo(ConnectionState.CLOSED);
        }
    }

    // ========================================================================
    // CLOSE AND ABORT
    // ========================================================================

    @Nested
    @DisplayName("close and abort")
    class CloseAndAbort {

        @Test
        @DisplayName("should close an open client gracefully")
        void shouldClose() {
            SimulatedRemoteClient client = new SimulatedRemoteClient();
            client.open().toCompletableFuture().join();

            client.close().toCompletableFuture().join();

            assertThat(client.state()).isEqualTo(ConnectionState.CLOSED);
            assertThat(client.abortCalls()).isZero();
        }

        @Test
        @DisplayName("should refuse to close a client that never opened")
        void shouldRefuseCloseBeforeOpen() {
            SimulatedRemoteClient client = new SimulatedRemoteClient();

            assertThatThrownBy(client::close)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("CREATED");
        }

        @Test
        @DisplayName("should refuse to close a faulted client")
        void shouldRefuseCloseWhenFaulted() {
            SimulatedRemoteClient client = new SimulatedRemoteClient()
                    .failOpenWith(new ConnectivityException("down"));
            client.open().toCompletableFuture().exceptionally(e -> null).join();

            assertThatThrownBy(client::close).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should fault when the graceful shutdown fails")
        void shouldFaultOnCloseFailure() {
            SimulatedRemoteClient client = new SimulatedRemoteClient()
                    .failCloseWith(new ConnectivityException("reset by peer"));
            client.open().toCompletableFuture().join();

            assertThatThrownBy(() -> client.close().toCompletableFuture().join())
                    .hasCauseInstanceOf(ConnectivityException.class);
            assertThat(client.state()).isEqualTo(ConnectionState.FAULTED);
        }

        @Test
        @DisplayName("should keep FAULTED when aborted")
        void shouldKeepFaultedOnAbort() {
            SimulatedRemoteClient client = new SimulatedRemoteClient();
            client.open().toCompletableFuture().join();
            client.fault(new ConnectivityException("dropped"));

            client.abort();

            assertThat(client.state()).isEqualTo(ConnectionState.FAULTED);
            assertThat(client.isAborted()).isTrue();
        }

        @Test
        @DisplayName("should release the transport only once")
        void shouldAbortOnce() {
            SimulatedRemoteClient client = new SimulatedRemoteClient();

            client.abort();
            client.abort();

            assertThat(client.state()).isEqualTo(ConnectionState.CLOSED);
            assertThat(client.abortCalls()).isEqualTo(1);
        }
    }
}
