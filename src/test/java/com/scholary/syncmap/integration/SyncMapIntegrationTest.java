package com.scholary.syncmap.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.syncmap.api.ConvertRequest;
import com.scholary.syncmap.api.FinetuneRequest;
import com.scholary.syncmap.api.InspectRequest;
import com.scholary.syncmap.api.SyncMapResponse;
import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.syncmap.SyncMapParameters;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * End-to-end test of the sync map API.
 *
 * <p>Starts the application on a random port and drives conversion, inspection and export
 * through HTTP against files in a temporary directory.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SyncMapIntegrationTest {

  private static final String VTT =
      "WEBVTT\n\nc1\n00:00.000 --> 00:01.200\nHello\n\nc2\n00:01.200 --> 00:03.000\nworld\n";

  @Autowired private TestRestTemplate restTemplate;

  @Autowired private SyncMapProperties properties;

  @TempDir Path tempDir;

  private Path input;

  @BeforeEach
  void setUp() throws Exception {
    input = tempDir.resolve("input.vtt");
    Files.writeString(input, VTT);
  }

  @Test
  void properties_shouldBindFromApplicationYaml() {
    assertThat(properties).isEqualTo(SyncMapProperties.defaults());
  }

  @Test
  void convert_shouldWriteSrtFile() throws Exception {
    Path output = tempDir.resolve("output.srt");
    ConvertRequest request =
        new ConvertRequest(input.toString(), "vtt", output.toString(), "srt", null);

    ResponseEntity<SyncMapResponse> response =
        restTemplate.postForEntity("/api/syncmaps/convert", request, SyncMapResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().fragmentCount()).isEqualTo(2);
    assertThat(Files.readString(output)).startsWith("1\n00:00:00,000 --> 00:00:01,200\nHello\n");
  }

  @Test
  void inspect_shouldReturnSyncMapJson() {
    ResponseEntity<String> response =
        restTemplate.postForEntity(
            "/api/syncmaps/inspect",
            new InspectRequest(input.toString(), "vtt", Map.of(SyncMapParameters.LANGUAGE, "en")),
            String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("\"id\" : \"c1\"", "\"language\" : \"en\"");
  }

  @Test
  void finetune_shouldWriteHtmlPage() {
    Path output = tempDir.resolve("page.html");
    FinetuneRequest request =
        new FinetuneRequest(
            input.toString(),
            "vtt",
            tempDir.resolve("audio.mp3").toString(),
            output.toString(),
            Map.of(SyncMapParameters.OUTPUT_FORMAT, "json"));

    ResponseEntity<SyncMapResponse> response =
        restTemplate.postForEntity("/api/syncmaps/finetune", request, SyncMapResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(output).exists();
  }

  @Test
  void convert_withMissingSmilParameter_shouldReturnUnprocessableEntity() {
    ConvertRequest request =
        new ConvertRequest(
            input.toString(), "vtt", tempDir.resolve("out.smil").toString(), "smil", null);

    ResponseEntity<Map> response =
        restTemplate.postForEntity("/api/syncmaps/convert", request, Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody().get("errorCode")).isEqualTo("SyncMapMissingParameterException");
  }

  @Test
  void inspect_withMissingFile_shouldReturnForbidden() {
    ResponseEntity<Map> response =
        restTemplate.postForEntity(
            "/api/syncmaps/inspect",
            new InspectRequest(tempDir.resolve("missing.vtt").toString(), "vtt", null),
            Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
  }

  @Test
  void convert_withBlankFields_shouldReturnBadRequest() {
    ConvertRequest request = new ConvertRequest("", "vtt", "", "srt", null);

    ResponseEntity<Map> response =
        restTemplate.postForEntity("/api/syncmaps/convert", request, Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat((String) response.getBody().get("details")).contains("inputPath", "outputPath");
  }
}
