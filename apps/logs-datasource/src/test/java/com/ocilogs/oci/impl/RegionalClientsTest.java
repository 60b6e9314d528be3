package com.ocilogs.oci.impl;

import com.oracle.bmc.identity.IdentityClient;
import com.oracle.bmc.logging.LoggingManagementClient;
import com.oracle.bmc.loggingsearch.LogSearchClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RegionalClientsTest {

    @Test
    void buildsAllThreeClients() throws Exception {
        LogSearchClient search = mock(LogSearchClient.class);
        LoggingManagementClient management = mock(LoggingManagementClient.class);
        IdentityClient identity = mock(IdentityClient.class);

        OciTenancyConnector.RegionalClients clients =
                OciTenancyConnector.RegionalClients.create(() -> search, () -> management, () -> identity);

        assertSame(search, clients.search());
        assertSame(management, clients.management());
        assertSame(identity, clients.identity());
        verify(search, never()).close();
    }

    @Test
    void failedManagementClientClosesTheSearchClient() throws Exception {
        LogSearchClient search = mock(LogSearchClient.class);
        IllegalStateException failure = new IllegalStateException("no endpoint for region");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> OciTenancyConnector.RegionalClients.create(() -> search, () -> {
                    throw failure;
                }, () -> mock(IdentityClient.class)));

        assertSame(failure, thrown);
        verify(search).close();
    }

    @Test
    void failedIdentityClientClosesTheOthers() throws Exception {
        LogSearchClient search = mock(LogSearchClient.class);
        LoggingManagementClient management = mock(LoggingManagementClient.class);

        assertThrows(IllegalStateException.class,
                () -> OciTenancyConnector.RegionalClients.create(() -> search, () -> management, () -> {
                    throw new IllegalStateException("identity endpoint unavailable");
                }));

        verify(search).close();
        verify(management).close();
    }
}
