package com.architecture.memory.graphexport.service.connection;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class GraphConnectionTest {

    @Mock
    private GraphSession session;

    @Mock
    private GraphSessionFactory sessionFactory;

    @Test
    void closeClearsSessionBeforeClosingFactory() {
        GraphConnection connection = new GraphConnection(session, sessionFactory);

        connection.close();

        InOrder order = inOrder(session, sessionFactory);
        order.verify(session).clear();
        order.verify(session).close();
        order.verify(sessionFactory).close();
    }

    @Test
    void closeIsIdempotent() {
        GraphConnection connection = new GraphConnection(session, sessionFactory);

        connection.close();
        connection.close();

        verify(session, times(1)).clear();
        verify(sessionFactory, times(1)).close();
    }

    @Test
    void factoryIsClosedEvenWhenClearFails() {
        doThrow(new IllegalStateException("clear failed")).when(session).clear();
        GraphConnection connection = new GraphConnection(session, sessionFactory);

        assertThatThrownBy(connection::close).hasMessage("clear failed");

        verify(session).close();
        verify(sessionFactory).close();
    }
}
