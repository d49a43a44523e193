package com.scholary.videogen.provider.aliyun;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videogen.TestFixtures;
import com.scholary.videogen.artifact.ArtifactResolver;
import com.scholary.videogen.job.InMemoryJobStore;
import com.scholary.videogen.job.Job;
import com.scholary.videogen.job.JobErrorKind;
import com.scholary.videogen.job.JobStatus;
import com.scholary.videogen.provider.CanonicalResult;
import com.scholary.videogen.provider.MediaDescriptor;
import com.scholary.videogen.provider.ProviderCallException;
import com.scholary.videogen.provider.ProviderRegistry;
import com.scholary.videogen.provider.http.MultipartPart;
import com.scholary.videogen.provider.http.ProviderHttpException;
import com.scholary.videogen.provider.http.ProviderTransport;
import com.scholary.videogen.service.TaskWorker;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AliyunProviderAdapterTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String API_URL = "https://dashscope.test/video-synthesis";
  private static final String KEYFRAME_URL = "https://dashscope.test/image2video";
  private static final String TASK_URL = "https://dashscope.test/tasks";
  private static final String POLICY_URL = "https://dashscope.test/uploads";
  private static final URI TASK_URI = URI.create(TASK_URL + "/task-1");
  private static final byte[] VIDEO_BYTES = {0, 0, 0, 24, 'f', 't', 'y', 'p'};

  @Mock(strictness = Mock.Strictness.LENIENT)
  private ProviderTransport transport;

  @TempDir Path dataDir;

  private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
  private ArtifactResolver artifactResolver;

  @BeforeEach
  void setUp() {
    artifactResolver =
        new ArtifactResolver(
            TestFixtures.properties(dataDir), transport, TestFixtures.HTTP, clock);
  }

  private AliyunProviderAdapter adapter(String apiKey, int maxAttempts) {
    AliyunProperties properties =
        new AliyunProperties(apiKey, API_URL, KEYFRAME_URL, TASK_URL, POLICY_URL, null);
    return new AliyunProviderAdapter(
        properties,
        transport,
        TestFixtures.HTTP,
        artifactResolver,
        TestFixtures.instantPoller(maxAttempts, clock),
        clock);
  }

  private static JsonNode json(String text) {
    try {
      return MAPPER.readTree(text.replace('\'', '"'));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }

  private static JsonNode taskStatus(String status) {
    return json("{'output': {'task_id': 'task-1', 'task_status': '" + status + "'}}");
  }

  private static JsonNode succeeded() {
    return json(
        "{'request_id': 'req-9', 'output': {'task_id': 'task-1', 'task_status': 'SUCCEEDED',"
            + " 'video_url': 'https://cdn.test/out.mp4', 'actual_prompt': 'a fluffy cat'},"
            + " 'usage': {'video_count': 1}}");
  }

  private void stubSubmit() {
    when(transport.postJson(eq(URI.create(API_URL)), anyMap(), any(JsonNode.class), any()))
        .thenReturn(taskStatus("PENDING"));
  }

  private void stubDownloads() {
    when(transport.download(any(URI.class), any(Path.class), any(Duration.class)))
        .thenAnswer(
            invocation -> {
              Path target = invocation.getArgument(1);
              Files.createDirectories(target.getParent());
              Files.write(target, VIDEO_BYTES);
              return (long) VIDEO_BYTES.length;
            });
  }

  private static URI isPolicyUri() {
    return argThat(uri -> uri != null && uri.toString().startsWith(POLICY_URL));
  }

  private ObjectNode textParams() {
    return MAPPER.createObjectNode().put("prompt", "a cat");
  }

  @Test
  void completesAfterSeveralPollsAndDownloadsTheVideo() {
    stubSubmit();
    when(transport.getJson(eq(TASK_URI), anyMap(), any()))
        .thenReturn(taskStatus("PENDING"), taskStatus("RUNNING"), succeeded());
    stubDownloads();

    CanonicalResult result = adapter("sk-test", 10).call("wanx2.1-t2v-turbo", textParams());

    assertThat(result.id()).isEqualTo("req-9");
    assertThat(result.model()).isEqualTo("wanx2.1-t2v-turbo");
    assertThat(result.videos()).hasSize(1);
    MediaDescriptor video = result.videos().get(0);
    assertThat(video.url()).isEqualTo("https://cdn.test/out.mp4");
    assertThat(video.localPath()).isNotEmpty();
    assertThat(Path.of(video.localPath())).exists().startsWith(dataDir.resolve("videos/aliyun"));
    assertThat(video.metadata().path("duration").asInt()).isEqualTo(5);
    assertThat(result.extras().path("actual_prompt").asText()).isEqualTo("a fluffy cat");
    assertThat(result.extras().path("model_type").asText()).isEqualTo("text_to_video");
    assertThat(result.extras().path("usage").path("video_count").asInt()).isEqualTo(1);
    verify(transport, times(3)).getJson(eq(TASK_URI), anyMap(), any());
  }

  @Test
  void sendsAsyncHeadersAndNormalizedBody() {
    stubSubmit();
    when(transport.getJson(eq(TASK_URI), anyMap(), any())).thenReturn(succeeded());
    stubDownloads();

    adapter("sk-test", 10).call("wanx2.1-t2v-turbo", textParams().put("duration", 9));

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
    ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
    verify(transport).postJson(eq(URI.create(API_URL)), headers.capture(), body.capture(), any());
    assertThat(headers.getValue())
        .containsEntry("Authorization", "Bearer sk-test")
        .containsEntry("X-DashScope-Async", "enable");
    assertThat(body.getValue().path("parameters").path("duration").asInt()).isEqualTo(5);
  }

  @Test
  void timesOutWhenTheTaskNeverFinishes() {
    stubSubmit();
    when(transport.getJson(eq(TASK_URI), anyMap(), any())).thenReturn(taskStatus("RUNNING"));

    assertThatThrownBy(() -> adapter("sk-test", 3).call("wanx2.1-t2v-turbo", textParams()))
        .isInstanceOf(ProviderCallException.class)
        .hasMessage("Task task-1 did not complete within 3 polls")
        .extracting(e -> ((ProviderCallException) e).getKind())
        .isEqualTo(ProviderCallException.Kind.REMOTE_TIMEOUT);
    verify(transport, times(3)).getJson(eq(TASK_URI), anyMap(), any());
    verify(transport, never()).download(any(), any(), any());
  }

  @Test
  void timeoutIsRecordedOnTheJob() {
    stubSubmit();
    when(transport.getJson(eq(TASK_URI), anyMap(), any())).thenReturn(taskStatus("RUNNING"));
    AliyunProviderAdapter adapter = adapter("sk-test", 3);
    InMemoryJobStore store = new InMemoryJobStore(clock);
    ProviderRegistry registry =
        ProviderRegistry.builder().register(adapter).defaultProvider("aliyun").build();
    TaskWorker worker = new TaskWorker(store, registry, MAPPER);
    Job job =
        store.insert(
            Job.pending(
                "t1",
                "u1",
                "aliyun",
                "wanx2.1-t2v-turbo",
                adapter.validateParameters("wanx2.1-t2v-turbo", textParams()),
                true,
                clock.instant()));

    worker.execute(job.id());

    Job stored = store.findById(job.id()).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.FAILED);
    assertThat(stored.errorKind()).isEqualTo(JobErrorKind.TIMEOUT);
    assertThat(stored.error()).startsWith("Timeout:");
  }

  @Test
  void remoteFailureCarriesProviderCodeAndMessage() {
    stubSubmit();
    when(transport.getJson(eq(TASK_URI), anyMap(), any()))
        .thenReturn(
            json(
                "{'output': {'task_id': 'task-1', 'task_status': 'FAILED',"
                    + " 'code': 'DataInspectionFailed', 'message': 'bad content'}}"));

    assertThatThrownBy(() -> adapter("sk-test", 10).call("wanx2.1-t2v-turbo", textParams()))
        .isInstanceOf(ProviderCallException.class)
        .hasMessage("Task failed: DataInspectionFailed - bad content");
  }

  @Test
  void missingTaskIdFailsWithPayload() {
    when(transport.postJson(eq(URI.create(API_URL)), anyMap(), any(JsonNode.class), any()))
        .thenReturn(json("{'code': 'InvalidParameter', 'message': 'nope'}"));

    assertThatThrownBy(() -> adapter("sk-test", 10).call("wanx2.1-t2v-turbo", textParams()))
        .isInstanceOf(ProviderCallException.class)
        .hasMessageContaining("Failed to get task_id")
        .hasMessageContaining("InvalidParameter");
  }

  @Test
  void httpErrorOnSubmitIsARemoteCallError() {
    when(transport.postJson(eq(URI.create(API_URL)), anyMap(), any(JsonNode.class), any()))
        .thenThrow(new ProviderHttpException(401, "{\"code\":\"InvalidApiKey\"}"));

    assertThatThrownBy(() -> adapter("sk-test", 10).call("wanx2.1-t2v-turbo", textParams()))
        .isInstanceOf(ProviderCallException.class)
        .hasMessageContaining("401")
        .extracting(e -> ((ProviderCallException) e).getKind())
        .isEqualTo(ProviderCallException.Kind.REMOTE_CALL);
  }

  @Test
  void missingApiKeyFailsBeforeAnyRequest() {
    assertThatThrownBy(() -> adapter("", 10).call("wanx2.1-t2v-turbo", textParams()))
        .isInstanceOf(ProviderCallException.class)
        .hasMessageContaining("API key");
    verifyNoInteractions(transport);
  }

  @Test
  void failedDownloadLeavesEmptyLocalPath() {
    stubSubmit();
    when(transport.getJson(eq(TASK_URI), anyMap(), any())).thenReturn(succeeded());
    when(transport.download(any(URI.class), any(Path.class), any(Duration.class)))
        .thenThrow(new ProviderHttpException(404, "gone"));

    CanonicalResult result = adapter("sk-test", 10).call("wanx2.1-t2v-turbo", textParams());

    assertThat(result.videos().get(0).localPath()).isEmpty();
    assertThat(result.videos().get(0).url()).isEqualTo("https://cdn.test/out.mp4");
  }

  @Test
  void providerReferencesAreNotStagedAgain() {
    stubSubmit();
    when(transport.getJson(eq(TASK_URI), anyMap(), any())).thenReturn(succeeded());
    stubDownloads();

    adapter("sk-test", 10)
        .call("wanx2.1-i2v-turbo", textParams().put("img_url", "oss://dashscope/dir/cat.png"));

    ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
    verify(transport).postJson(any(), anyMap(), body.capture(), any());
    assertThat(body.getValue().path("input").path("img_url").asText())
        .isEqualTo("oss://dashscope/dir/cat.png");
    verify(transport, never()).postMultipart(any(), anyList(), any());
  }

  @Test
  void externalImageIsUploadedBeforeSubmit() {
    when(transport.getJson(isPolicyUri(), anyMap(), any()))
        .thenReturn(
            json(
                "{'data': {'upload_host': 'https://oss.test', 'upload_dir': 'dashscope/u1',"
                    + " 'oss_access_key_id': 'ak', 'signature': 'sig', 'policy': 'pol',"
                    + " 'x_oss_object_acl': 'private', 'x_oss_forbid_overwrite': 'true'}}"));
    stubDownloads();
    stubSubmit();
    when(transport.getJson(eq(TASK_URI), anyMap(), any())).thenReturn(succeeded());

    adapter("sk-test", 10)
        .call("wanx2.1-i2v-plus", textParams().put("img_url", "https://images.test/cat.png"));

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<MultipartPart>> parts = ArgumentCaptor.forClass(List.class);
    verify(transport).postMultipart(eq(URI.create("https://oss.test")), parts.capture(), any());
    assertThat(parts.getValue())
        .extracting(MultipartPart::name)
        .contains("OSSAccessKeyId", "Signature", "policy", "key", "file");
    ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
    verify(transport).postJson(any(), anyMap(), body.capture(), any());
    assertThat(body.getValue().path("input").path("img_url").asText())
        .startsWith("oss://dashscope/u1/")
        .endsWith(".png");
  }

  @Test
  void stagingFailureIsReportedAsInputStaging() {
    when(transport.getJson(isPolicyUri(), anyMap(), any()))
        .thenThrow(new ProviderHttpException(403, "denied"));

    assertThatThrownBy(
            () ->
                adapter("sk-test", 10)
                    .call(
                        "wanx2.1-i2v-plus",
                        textParams().put("img_url", "https://images.test/cat.png")))
        .isInstanceOf(ProviderCallException.class)
        .extracting(e -> ((ProviderCallException) e).getKind())
        .isEqualTo(ProviderCallException.Kind.INPUT_STAGING);
    verify(transport, never()).postJson(any(), anyMap(), any(), any());
  }

  @Test
  void keyframeModelsUseTheKeyframeEndpoint() {
    when(transport.postJson(eq(URI.create(KEYFRAME_URL)), anyMap(), any(JsonNode.class), any()))
        .thenReturn(taskStatus("PENDING"));
    when(transport.getJson(eq(TASK_URI), anyMap(), any())).thenReturn(succeeded());
    stubDownloads();

    CanonicalResult result =
        adapter("sk-test", 10)
            .call(
                "wanx2.1-kf2v-plus",
                MAPPER
                    .createObjectNode()
                    .put("first_frame_url", "oss://d/a.png")
                    .put("last_frame_url", "oss://d/b.png"));

    assertThat(result.extras().path("model_type").asText()).isEqualTo("keyframe_to_video");
  }
}
