package com.starscape.imageedit.integration;

import com.starscape.imageedit.features.remotetask.domain.NodeInfo;
import com.starscape.imageedit.features.submitjob.domain.TaskRegistry;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the complete edit flow.
 * Tests: submit job → remote task created → webhook callback → result stored → job completed
 */
@ActiveProfiles("test")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestRemoteConfig.class)
public class EditJobFlowIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private FakeRemoteTaskService remote;

    @Autowired
    private TaskRegistry taskRegistry;

    @TempDir
    Path workDir;

    @BeforeEach
    void setUp() {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";
    }

    private List<String> awaitRegisteredTasks(int before, int count) {
        await().atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(100))
                .until(() -> remote.createdTasks().size() == before + count
                    && remote.createdTasks().subList(before, before + count).stream()
                        .allMatch(taskId -> taskRegistry.find(taskId).isPresent()));
        return List.copyOf(remote.createdTasks().subList(before, before + count));
    }

    private void awaitJobStatus(String jobId, String status) {
        await().atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() -> given()
                        .get("/queries/edit-jobs/" + jobId)
                        .then()
                        .statusCode(200)
                        .body("status", equalTo(status)));
    }

    @Test
    void shouldCompleteWholeImageFlow() throws Exception {
        Path image = TestUtils.writeTestPngImage(workDir.resolve("photo.png"), 64, 48);
        int before = remote.createdTasks().size();

        // 1. Submit job
        String jobId = given()
                .contentType(ContentType.JSON)
                .body(Map.of("imagePath", image.toString()))
                .post("/commands/edit-jobs")
                .then()
                .statusCode(202)
                .body("jobId", startsWith("job_"))
                .extract()
                .path("jobId");

        // 2. Remote task is created and the job waits for it
        String taskId = awaitRegisteredTasks(before, 1).get(0);
        NodeInfo imageNode = remote.nodesOf(taskId).get(0);
        assertEquals("200", imageNode.nodeId());
        assertTrue(imageNode.fieldValue().endsWith("photo.png"));
        given()
                .get("/queries/edit-jobs/" + jobId)
                .then()
                .statusCode(200)
                .body("kind", equalTo("IMAGE"))
                .body("status", equalTo("IN_PROGRESS"))
                .body("expected", equalTo(1))
                .body("doneCount", equalTo(0));

        // 3. Webhook delivers the result
        given()
                .contentType(ContentType.JSON)
                .body(TestUtils.successCallback(taskId, "https://cdn.test/" + taskId + ".png"))
                .post("/rhcallback")
                .then()
                .statusCode(200)
                .body("ok", equalTo(true))
                .body("outcome", equalTo("ACCEPTED"));

        // 4. Job completes and the result sits next to the source
        awaitJobStatus(jobId, "COMPLETED");
        assertTrue(Files.exists(workDir.resolve("photo_proto.png")));

        // 5. Redelivery is acknowledged but ignored
        given()
                .contentType(ContentType.JSON)
                .body(TestUtils.successCallback(taskId, "https://cdn.test/" + taskId + ".png"))
                .post("/rhcallback")
                .then()
                .statusCode(200)
                .body("outcome", equalTo("UNKNOWN_TASK"));
        given()
                .get("/queries/edit-jobs/" + jobId)
                .then()
                .body("doneCount", equalTo(1));
    }

    @Test
    void shouldCompleteBatchFlowWithPartialFailure() throws Exception {
        Path image = TestUtils.writeTestPngImage(workDir.resolve("scene.png"), 80, 60);
        Path config = workDir.resolve("scene.json");
        Files.writeString(config, """
            {"differences": [
              {"points": [{"x": 0.1, "y": 0.1}, {"x": 0.4, "y": 0.1}, {"x": 0.4, "y": 0.4}, {"x": 0.1, "y": 0.4}], "text": "add a hat"},
              {"points": [{"x": 0.5, "y": 0.5}, {"x": 0.9, "y": 0.5}, {"x": 0.9, "y": 0.9}, {"x": 0.5, "y": 0.9}], "text": "remove the cup"}
            ]}
            """);
        int before = remote.createdTasks().size();

        String jobId = given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "imagePath", image.toString(),
                    "configPath", config.toString(),
                    "coordinateOrigin", "bottom-left"))
                .post("/commands/batch-edit-jobs")
                .then()
                .statusCode(202)
                .extract()
                .path("jobId");

        List<String> tasks = awaitRegisteredTasks(before, 2);
        String first = tasks.get(0);
        String second = tasks.get(1);
        assertEquals("add a hat", remote.nodesOf(first).get(0).fieldValue());

        given().contentType(ContentType.JSON)
                .body(TestUtils.successCallback(first, "https://cdn.test/a.png"))
                .post("/rhcallback")
                .then().statusCode(200);
        given().contentType(ContentType.JSON)
                .body(TestUtils.failureCallback(second, 805, "workflow error"))
                .post("/rhcallback")
                .then().statusCode(200);

        awaitJobStatus(jobId, "COMPLETED_WITH_ERRORS");
        given()
                .get("/queries/edit-jobs/" + jobId)
                .then()
                .body("succeededCount", equalTo(1))
                .body("failedCount", equalTo(1))
                .body("parts.status", containsInAnyOrder("SUCCEEDED", "REMOTE_FAILED"));
        assertTrue(Files.exists(workDir.resolve("scene_region0.png")));
        assertFalse(Files.exists(workDir.resolve("scene_region1.png")));
    }

    @Test
    void shouldFailBatchJobWhenConfigIsMissing() throws Exception {
        Path image = TestUtils.writeTestPngImage(workDir.resolve("lonely.png"), 16, 16);

        String jobId = given()
                .contentType(ContentType.JSON)
                .body(Map.of("imagePath", image.toString(), "configPath", workDir.resolve("none.json").toString()))
                .post("/commands/batch-edit-jobs")
                .then()
                .statusCode(202)
                .extract()
                .path("jobId");

        awaitJobStatus(jobId, "FAILED");
    }

    @Test
    void shouldAcknowledgeUnusableCallbacks() {
        given()
                .contentType(ContentType.JSON)
                .body("this is not json")
                .post("/rhcallback")
                .then()
                .statusCode(200)
                .body("ok", equalTo(true))
                .body("outcome", equalTo("MISSING_TASK_ID"));

        given()
                .contentType(ContentType.JSON)
                .body(TestUtils.successCallback("never-created", "https://cdn.test/x.png"))
                .post("/rhcallback")
                .then()
                .statusCode(200)
                .body("outcome", equalTo("UNKNOWN_TASK"));
    }

    @Test
    void shouldRejectInvalidRequests() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("imagePath", ""))
                .post("/commands/edit-jobs")
                .then()
                .statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("imagePath", "/a.png", "configPath", "/a.json", "coordinateOrigin", "center"))
                .post("/commands/batch-edit-jobs")
                .then()
                .statusCode(400);

        given()
                .get("/queries/edit-jobs/job_unknown")
                .then()
                .statusCode(404)
                .body("code", equalTo("NOT_FOUND"));
    }

    @Test
    void shouldReportHealth() {
        given()
                .get("/health")
                .then()
                .statusCode(200)
                .body("status", equalTo("UP"))
                .body("capacity", equalTo(4));
    }
}
