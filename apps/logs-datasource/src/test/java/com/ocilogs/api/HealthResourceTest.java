package com.ocilogs.api;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.is;

@QuarkusTest
class HealthResourceTest {
    @Test
    void livenessEndpointAnswersOk() {
        given()
          .when().get("/healthz")
          .then()
             .statusCode(200)
             .body(is("ok"));
    }

}
