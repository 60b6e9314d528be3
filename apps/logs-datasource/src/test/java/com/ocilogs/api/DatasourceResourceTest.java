package com.ocilogs.api;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ocilogs.oci.StubTenancyConnector;
import com.ocilogs.oci.TenancyConnectorFactory;
import com.ocilogs.settings.SettingsFixtures;
import io.quarkus.test.junit.QuarkusMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class DatasourceResourceTest {

    StubTenancyConnector connector;

    @BeforeEach
    void setUp() {
        connector = new StubTenancyConnector("ocid1.tenancy.oc1..alpha");
        connector.regions = List.of("us-phoenix-1", "eu-frankfurt-1");
        TenancyConnectorFactory factory = mock(TenancyConnectorFactory.class);
        when(factory.forProfile(any())).thenReturn(connector);
        QuarkusMock.installMockForType(factory, TenancyConnectorFactory.class);
    }

    @Test
    void configuredDatasourceAnswersQueriesAndHealth() {
        configure("ds-query");

        given()
                .when().get("/v1/datasources/ds-query/tenancies")
                .then()
                .statusCode(200)
                .body("[0].name", equalTo("DEFAULT/"));

        given()
                .when().get("/v1/datasources/ds-query/health")
                .then()
                .statusCode(200)
                .body("status", equalTo("OK"))
                .body("message", equalTo("Success"));

        given()
                .contentType(ContentType.JSON)
                .body("{\"queries\":[{\"refId\":\"R\",\"queryType\":\"regions\",\"tenancy\":\"DEFAULT/\","
                        + "\"timeRange\":{\"fromEpochMs\":0,\"toEpochMs\":600000}}]}")
                .when().post("/v1/datasources/ds-query/query")
                .then()
                .statusCode(200)
                .body("results.R.frame.fields[0].name", equalTo("text"))
                .body("results.R.frame.fields[0].values", hasItems("eu-frankfurt-1", "us-phoenix-1"));
    }

    @Test
    void failedQueryIsReportedPerRefId() {
        configure("ds-failure");
        connector.failure = new IllegalStateException("connection reset");

        given()
                .contentType(ContentType.JSON)
                .body("{\"queries\":[{\"refId\":\"A\",\"queryType\":\"searchLogs\",\"searchQuery\":\"search \\\"ns\\\"\","
                        + "\"timeRange\":{\"fromEpochMs\":0,\"toEpochMs\":600000}}]}")
                .when().post("/v1/datasources/ds-failure/query")
                .then()
                .statusCode(200)
                .body("results.A.error", containsString("connection reset"));

        given()
                .when().get("/v1/datasources/ds-failure/health")
                .then()
                .statusCode(200)
                .body("status", equalTo("ERROR"));
    }

    @Test
    void unknownEnvironmentIsABadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body(SettingsFixtures.environment("laptop").profile(0, "alpha").json().toString())
                .when().put("/v1/datasources/ds-bad")
                .then()
                .statusCode(400)
                .body("mensaje", containsString("unknown environment"))
                .body("requestId", notNullValue());
    }

    @Test
    void removedDatasourceIsGone() {
        configure("ds-removed");

        given()
                .when().delete("/v1/datasources/ds-removed")
                .then()
                .statusCode(204);

        given()
                .when().get("/v1/datasources/ds-removed/health")
                .then()
                .statusCode(404);
    }

    private void configure(String uid) {
        given()
                .contentType(ContentType.JSON)
                .body(SettingsFixtures.local("single").profile(0, "alpha").json().toString())
                .when().put("/v1/datasources/" + uid)
                .then()
                .statusCode(200)
                .body("tenancies", hasItems("DEFAULT/"));
    }
}
