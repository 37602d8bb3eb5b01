package com.narrativelens.backend.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.narrativelens.backend.ai.AiSummarizationService;
import com.narrativelens.backend.config.LabelingConfig;
import com.narrativelens.backend.config.ScrapingConfig;
import com.narrativelens.backend.config.SummarizationConfig;
import com.narrativelens.backend.enrichment.EnrichmentCache;
import com.narrativelens.backend.enrichment.EnrichmentService;
import com.narrativelens.backend.enrichment.FallbackValueResolver;
import com.narrativelens.backend.labeling.LabelScoringService;
import com.narrativelens.backend.model.dto.EnrichmentStatusDTO;
import com.narrativelens.backend.model.entity.Article;
import com.narrativelens.backend.model.enums.NarrativeLabel;
import com.narrativelens.backend.scraping.ArticleExtractorService;
import com.narrativelens.backend.scraping.ImageValidator;
import com.narrativelens.backend.scraping.fetch.FetchResult;
import com.narrativelens.backend.scraping.fetch.FetchedPage;
import com.narrativelens.backend.scraping.fetch.PageFetcher;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.SyncTaskExecutor;

@ExtendWith(MockitoExtension.class)
class ArticlePipelineServiceTest {

    private static final String PAGE = """
            <html><head><meta name="twitter:image" content="https://cdn.example.com/img/kremlin.jpg"></head>
            <body><div class="story-content"><p>Putin met the delegation in Moscow on Friday.</p></div></body></html>""";

    @Mock
    private PageFetcher pageFetcher;

    @Mock
    private ObjectProvider<ChatModel> chatModelProvider;

    private ArticlePipelineService pipelineService;

    @BeforeEach
    void setUp() {
        ScrapingConfig scrapingConfig = new ScrapingConfig();
        ImageValidator imageValidator = new ImageValidator(scrapingConfig);
        AiSummarizationService summarizer =
                new AiSummarizationService(chatModelProvider, new SummarizationConfig(), Runnable::run);
        EnrichmentService enrichmentService = new EnrichmentService(
                pageFetcher,
                new ArticleExtractorService(scrapingConfig, imageValidator),
                new FallbackValueResolver(scrapingConfig, imageValidator),
                new EnrichmentCache(),
                summarizer,
                scrapingConfig,
                new SyncTaskExecutor());
        pipelineService = new ArticlePipelineService(
                enrichmentService, new LabelScoringService(new LabelingConfig(), new Random(7)));
    }

    @Test
    void shouldEnrichThenLabelArticles() {
        when(pageFetcher.fetch(anyString(), anyInt(), any(Duration.class)))
                .thenAnswer(invocation -> {
                    String url = invocation.getArgument(0);
                    return FetchResult.success(url, new FetchedPage(url, PAGE), 1);
                });
        List<Article> articles = List.of(
                article("Delegation visits", "https://news.example.com/a"),
                article("Delegation visits again", "https://news.example.com/b"));
        List<Double> fractions = new ArrayList<>();

        List<Article> result = pipelineService.run(articles, (fraction, message) -> fractions.add(fraction));

        assertThat(result).isSameAs(articles);
        assertThat(result).allSatisfy(a -> {
            assertThat(a.getText()).isEqualTo("Putin met the delegation in Moscow on Friday.");
            assertThat(a.getImageUrl()).isEqualTo("https://cdn.example.com/img/kremlin.jpg");
            assertThat(a.getLabelScores().get(NarrativeLabel.PRO_RUSSIA)).isEqualTo(0.4);
            assertThat(a.getLabelScores().get(NarrativeLabel.FACTUAL)).isZero();
        });
        assertThat(fractions).containsExactly(0.5, 1.0, 1.0);
    }

    @Test
    void shouldRunWithoutListener() {
        Article article = article("Breaking news from the capital", null);

        List<Article> result = pipelineService.run(List.of(article));

        assertThat(result.get(0).getText()).isEqualTo("Breaking news from the capital...");
        assertThat(result.get(0).getImageUrl()).isEqualTo("https://placehold.co/600x400?text=No+Image");
        assertThat(result.get(0).getLabelScores().get(NarrativeLabel.SENSATIONALIST)).isEqualTo(0.2);
    }

    @Test
    void shouldTrackAsyncTaskStatus() throws Exception {
        Article article = article("Quiet day", null);
        String taskId = pipelineService.newTaskId();

        PipelineResult result = pipelineService.executeAsync(taskId, List.of(article)).get();

        EnrichmentStatusDTO status = pipelineService.getTaskStatus(taskId);
        assertThat(status.getStatus()).isEqualTo("COMPLETED");
        assertThat(status.getProgressPercentage()).isEqualTo(100.0);
        assertThat(status.getReport()).isSameAs(result.getReport());
        assertThat(pipelineService.getAllTaskStatuses()).containsKey(taskId);
        assertThat(pipelineService.requestCancel(taskId)).isFalse();
    }

    @Test
    void shouldRejectCancelForUnknownTask() {
        assertThat(pipelineService.requestCancel("pipeline-missing")).isFalse();
        assertThat(pipelineService.getTaskStatus("pipeline-missing")).isNull();
    }

    private static Article article(String headline, String url) {
        return Article.builder().headline(headline).url(url).build();
    }
}
