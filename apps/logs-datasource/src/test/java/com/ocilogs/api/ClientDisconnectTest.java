package com.ocilogs.api;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ocilogs.query.QueryContext;
import com.ocilogs.query.RequestCancelledException;
import io.vertx.core.Handler;
import io.vertx.core.http.HttpServerResponse;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ClientDisconnectTest {

    @Test
    void closedConnectionCancelsTheRequest() {
        HttpServerResponse response = mock(HttpServerResponse.class);
        AtomicReference<Handler<Void>> closeHandler = new AtomicReference<>();
        when(response.closeHandler(any())).thenAnswer(invocation -> {
            closeHandler.set(invocation.getArgument(0));
            return response;
        });

        QueryContext context = DatasourceResource.cancelOnClose(new QueryContext("req-1"), response);
        assertFalse(context.isCancelled());

        closeHandler.get().handle(null);

        assertTrue(context.isCancelled());
        assertThrows(RequestCancelledException.class, () -> context.checkCancelled("ListCompartments"));
    }

    @Test
    void openConnectionLeavesTheRequestRunning() {
        HttpServerResponse response = mock(HttpServerResponse.class);

        QueryContext context = DatasourceResource.cancelOnClose(new QueryContext("req-2"), response);

        verify(response).closeHandler(any());
        assertFalse(context.isCancelled());
    }
}
