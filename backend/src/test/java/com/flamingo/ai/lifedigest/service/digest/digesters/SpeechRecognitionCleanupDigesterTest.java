package com.flamingo.ai.lifedigest.service.digest.digesters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.lifedigest.agent.TranscriptCleanupAgent;
import com.flamingo.ai.lifedigest.domain.entity.DigestRecord;
import com.flamingo.ai.lifedigest.domain.entity.FileRecord;
import com.flamingo.ai.lifedigest.domain.enums.DigestStatus;
import com.flamingo.ai.lifedigest.exception.DependencyNotReadyException;
import com.flamingo.ai.lifedigest.service.digest.DigestInput;
import com.flamingo.ai.lifedigest.service.digest.DigestNames;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SpeechRecognitionCleanupDigesterTest {

  private static final String PATH = "audio/meeting.m4a";

  @Mock private TranscriptCleanupAgent transcriptCleanupAgent;

  private SpeechRecognitionCleanupDigester digester;
  private FileRecord audio;

  @BeforeEach
  void setUp() {
    digester = new SpeechRecognitionCleanupDigester(transcriptCleanupAgent, new ObjectMapper());
    audio = FileRecord.builder().path(PATH).name("meeting.m4a").mimeType("audio/mp4").build();
  }

  @Test
  @DisplayName("should wait for a transcript that is still pending")
  void shouldRaiseNotReady_whenTranscriptPending() {
    List<DigestRecord> digests = List.of(transcript(DigestStatus.PENDING, null));

    assertThatThrownBy(() -> digester.digest(audio, digests))
        .isInstanceOfSatisfying(
            DependencyNotReadyException.class,
            notReady -> {
              assertThat(notReady.getDependency()).isEqualTo(DigestNames.SPEECH_RECOGNITION);
              assertThat(notReady.getDependencyStatus()).isEqualTo(DigestStatus.PENDING);
            });
    verify(transcriptCleanupAgent, never()).cleanup(anyString());
  }

  @Test
  @DisplayName("should wait for a transcript that has no record yet")
  void shouldRaiseNotReady_whenTranscriptMissing() {
    assertThatThrownBy(() -> digester.digest(audio, List.of()))
        .isInstanceOf(DependencyNotReadyException.class)
        .hasMessageContaining("missing");
  }

  @Test
  @DisplayName("should complete empty when the transcript is empty")
  void shouldCompleteEmpty_whenNoTranscriptContent() {
    List<DigestInput> results =
        digester.digest(audio, List.of(transcript(DigestStatus.COMPLETED, null)));

    assertThat(results).containsExactly(DigestInput.completed(PATH, digester.getName(), null));
    verify(transcriptCleanupAgent, never()).cleanup(anyString());
  }

  @Test
  @DisplayName("should send speaker-labelled lines to the cleanup agent")
  void shouldCleanSpeakerLines() {
    // given
    String json =
        "{\"text\":\"hello world\",\"segments\":["
            + "{\"speaker\":\"SPEAKER_00\",\"text\":\" helo \"},"
            + "{\"speaker\":\"SPEAKER_01\",\"text\":\"wrld\"}]}";
    when(transcriptCleanupAgent.cleanup("SPEAKER_00: helo\nSPEAKER_01: wrld"))
        .thenReturn("SPEAKER_00: hello\nSPEAKER_01: world\n");

    // when
    List<DigestInput> results =
        digester.digest(audio, List.of(transcript(DigestStatus.COMPLETED, json)));

    // then
    assertThat(results.get(0).content()).isEqualTo("SPEAKER_00: hello\nSPEAKER_01: world");
    assertThat(digester.getDependencies()).containsExactly(DigestNames.SPEECH_RECOGNITION);
  }

  private static DigestRecord transcript(DigestStatus status, String content) {
    return DigestRecord.builder()
        .filePath(PATH)
        .digester(DigestNames.SPEECH_RECOGNITION)
        .status(status)
        .content(content)
        .build();
  }
}
