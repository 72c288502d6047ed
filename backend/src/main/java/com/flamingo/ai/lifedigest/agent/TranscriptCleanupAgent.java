package com.flamingo.ai.lifedigest.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that repairs speech recognition errors in a transcript. */
public interface TranscriptCleanupAgent {

  @SystemMessage(
      """
        You are a transcript editor. Fix speech recognition errors in the transcript: misheard
        words, broken names and technical terms, wrong punctuation and casing. Keep the
        original language, wording and meaning. Do not summarize, translate, or add content.
        Keep one line per segment, prefixed with its speaker label exactly as given.
        Return only the corrected transcript.
        """)
  @UserMessage("""
        Transcript:
        {{transcript}}
        """)
  String cleanup(@V("transcript") String transcript);
}
