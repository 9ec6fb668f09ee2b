package com.architecture.memory.graphexport.service.connection;

import com.architecture.memory.graphexport.config.PersistenceConfig;
import com.architecture.memory.graphexport.exception.GraphAuthenticationException;
import com.architecture.memory.graphexport.exception.GraphConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Opens a session to the graph database.
 *
 * An unreachable database is retried with a fixed delay until the configured number of
 * attempts is used up. Rejected credentials end the process straight away: retrying cannot
 * fix them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectionManager {

    private final SessionFactoryConnector connector;
    private final RetrySleeper retrySleeper;
    private final FatalErrorHandler fatalErrorHandler;

    /**
     * @return a connection owning both the session and its factory; the caller closes it
     * @throws GraphConnectionException if every attempt failed or the wait was interrupted
     * @throws GraphAuthenticationException if the fatal error handler returns after an authentication failure
     */
    public GraphConnection connect(PersistenceConfig config) {
        Objects.requireNonNull(config, "config");
        ConnectionAttempts attempts = new ConnectionAttempts(config.getRetry().getMaxAttempts());

        while (attempts.getState() == ConnectionState.ATTEMPTING) {
            GraphSessionFactory sessionFactory = null;
            try {
                sessionFactory = connector.connect(config);
                GraphSession session = sessionFactory.openSession();
                attempts.connected();
                log.info("[neo4j-connect] Connected to {} after {} attempt(s)", config.getUri(), attempts.getFailures() + 1);
                return new GraphConnection(session, sessionFactory);
            } catch (ServiceUnavailableException ex) {
                closeAfterFailure(sessionFactory, ex);
                attempts.transientFailure(ex);
                log.error("[neo4j-connect] Unable to connect to {} (attempt {}/{}), ensure the database is running "
                                + "and that there is a working network connection to it: {}",
                        config.getUri(), attempts.getFailures(), attempts.getMaxAttempts(), ex.getMessage());
                if (attempts.getState() == ConnectionState.ATTEMPTING) {
                    pause(config, attempts);
                }
            } catch (AuthenticationException ex) {
                closeAfterFailure(sessionFactory, ex);
                attempts.authenticationFailure();
                String message = "Unable to connect to " + config.getUri() + ", wrong username/password!";
                fatalErrorHandler.terminate(GraphAuthenticationException.EXIT_CODE, message, ex);
                throw new GraphAuthenticationException(message, ex);
            } catch (RuntimeException ex) {
                closeAfterFailure(sessionFactory, ex);
                throw ex;
            }
        }

        throw new GraphConnectionException("Unable to connect to " + config.getUri()
                + " after " + attempts.getFailures() + " attempt(s)", attempts.getLastFailure());
    }

    private void pause(PersistenceConfig config, ConnectionAttempts attempts) {
        try {
            retrySleeper.sleep(config.getRetry().getDelay());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GraphConnectionException("Interrupted while waiting to reconnect to " + config.getUri(),
                    attempts.getLastFailure());
        }
    }

    private void closeAfterFailure(GraphSessionFactory sessionFactory, RuntimeException failure) {
        if (sessionFactory == null) {
            return;
        }
        try {
            sessionFactory.close();
        } catch (RuntimeException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    /**
     * Attempt counter and state for one {@link #connect} call.
     */
    static final class ConnectionAttempts {

        private final int maxAttempts;
        private int failures;
        private ConnectionState state = ConnectionState.ATTEMPTING;
        private RuntimeException lastFailure;

        ConnectionAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
        }

        void transientFailure(RuntimeException failure) {
            requireAttempting();
            failures++;
            lastFailure = failure;
            if (failures >= maxAttempts) {
                state = ConnectionState.EXHAUSTED_RETRIES;
            }
        }

        void authenticationFailure() {
            requireAttempting();
            state = ConnectionState.AUTH_FAILED;
        }

        void connected() {
            requireAttempting();
            state = ConnectionState.CONNECTED;
        }

        private void requireAttempting() {
            if (state.isTerminal()) {
                throw new IllegalStateException("Connection attempts already ended in " + state);
            }
        }

        ConnectionState getState() {
            return state;
        }

        int getFailures() {
            return failures;
        }

        int getMaxAttempts() {
            return maxAttempts;
        }

        RuntimeException getLastFailure() {
            return lastFailure;
        }
    }
}
