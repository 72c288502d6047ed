package com.flamingo.ai.lifedigest.config;

import com.flamingo.ai.lifedigest.service.digest.DigesterRegistry;
import com.flamingo.ai.lifedigest.service.digest.digesters.DocToMarkdownDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.ImageCaptioningDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.ImageObjectsDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.ImageOcrDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.SearchKeywordDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.SearchSemanticDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.SpeakerEmbeddingDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.SpeechRecognitionCleanupDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.SpeechRecognitionDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.SpeechRecognitionSummaryDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.TagsDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.UrlCrawlDigester;
import com.flamingo.ai.lifedigest.service.digest.digesters.UrlCrawlSummaryDigester;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the digesters. Order matters: a digester only sees outputs of digesters listed before
 * it within the same run.
 */
@Configuration
public class DigesterConfig {

  @Bean
  public DigesterRegistry digesterRegistry(
      UrlCrawlDigester urlCrawl,
      DocToMarkdownDigester docToMarkdown,
      ImageOcrDigester imageOcr,
      ImageCaptioningDigester imageCaptioning,
      ImageObjectsDigester imageObjects,
      SpeechRecognitionDigester speechRecognition,
      SpeakerEmbeddingDigester speakerEmbedding,
      SpeechRecognitionCleanupDigester speechRecognitionCleanup,
      SpeechRecognitionSummaryDigester speechRecognitionSummary,
      UrlCrawlSummaryDigester urlCrawlSummary,
      TagsDigester tags,
      SearchKeywordDigester searchKeyword,
      SearchSemanticDigester searchSemantic) {
    return new DigesterRegistry(
        List.of(
            urlCrawl,
            docToMarkdown,
            imageOcr,
            imageCaptioning,
            imageObjects,
            speechRecognition,
            speakerEmbedding,
            speechRecognitionCleanup,
            speechRecognitionSummary,
            urlCrawlSummary,
            tags,
            searchKeyword,
            searchSemantic));
  }
}
