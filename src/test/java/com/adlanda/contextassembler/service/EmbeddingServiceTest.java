package com.adlanda.contextassembler.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    @Mock
    private EmbeddingModel embeddingModel;

    @Test
    void embedAll_returnsVectorsInInputOrder() {
        when(embeddingModel.embedForResponse(anyList())).thenReturn(new EmbeddingResponse(List.of(
                new Embedding(new float[]{0f, 1f}, 1),
                new Embedding(new float[]{1f, 0f}, 0))));
        EmbeddingService service = new EmbeddingService(embeddingModel, "test-model", 100);

        List<float[]> vectors = service.embedAll(List.of("first", "second"));

        assertThat(vectors.get(0)).containsExactly(1f, 0f);
        assertThat(vectors.get(1)).containsExactly(0f, 1f);
    }

    @Test
    @SuppressWarnings("unchecked")
    void embedAll_truncatesLongTextsAndReplacesBlankOnes() {
        when(embeddingModel.embedForResponse(anyList())).thenReturn(new EmbeddingResponse(List.of(
                new Embedding(new float[]{1f}, 0),
                new Embedding(new float[]{1f}, 1))));
        EmbeddingService service = new EmbeddingService(embeddingModel, "test-model", 5);

        service.embedAll(List.of("abcdefghij", "   "));

        ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass(List.class);
        verify(embeddingModel).embedForResponse(captor.capture());
        assertThat(captor.getValue()).containsExactly("abcde", " ");
    }

    @Test
    void embedAll_wrongResultCount_throwsException() {
        when(embeddingModel.embedForResponse(anyList())).thenReturn(new EmbeddingResponse(List.of(
                new Embedding(new float[]{1f}, 0))));
        EmbeddingService service = new EmbeddingService(embeddingModel, "test-model", 100);

        assertThatThrownBy(() -> service.embedAll(List.of("a", "b")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    void embedAll_emptyInput_doesNotCallModel() {
        EmbeddingService service = new EmbeddingService(embeddingModel, "test-model", 100);

        assertThat(service.embedAll(List.of())).isEmpty();
        verify(embeddingModel, times(0)).embedForResponse(anyList());
    }

    @Test
    void isAvailable_checksOnceAndCaches() {
        when(embeddingModel.dimensions()).thenReturn(1536);
        EmbeddingService service = new EmbeddingService(embeddingModel, "test-model", 100);

        assertThat(service.isAvailable()).isTrue();
        assertThat(service.isAvailable()).isTrue();
        verify(embeddingModel, times(1)).dimensions();
    }

    @Test
    void isAvailable_startupCheckFails_returnsFalse() {
        when(embeddingModel.dimensions()).thenThrow(new RuntimeException("connection refused"));
        EmbeddingService service = new EmbeddingService(embeddingModel, "test-model", 100);

        assertThat(service.isAvailable()).isFalse();
    }

    @Test
    void isAvailable_noModel_returnsFalse() {
        EmbeddingService service = new EmbeddingService(null, "test-model", 100);

        assertThat(service.isAvailable()).isFalse();
        assertThatThrownBy(() -> service.embed("text")).isInstanceOf(IllegalStateException.class);
    }
}
