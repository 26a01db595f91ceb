package com.wshg.productsearch.client;

import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;
import com.wshg.productsearch.common.convention.exception.InvalidInputException;
import com.wshg.productsearch.common.convention.exception.UpstreamException;
import com.wshg.productsearch.config.ProductSearchProperties;
import com.wshg.productsearch.dto.OllamaEmbedRequest;
import com.wshg.productsearch.dto.OllamaEmbedResponse;
import com.wshg.productsearch.dto.OllamaTagsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;

/**
 * Ollama 向量化客户端：POST /api/embed 生成向量，GET /api/tags 做健康检查。
 * 失败不在内部重试，由后台任务队列负责重放。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OllamaEmbeddingClient implements EmbeddingClient {

    private static final String OLLAMA_EMBED_PATH = "/api/embed";
    private static final String OLLAMA_TAGS_PATH = "/api/tags";

    private final ProductSearchProperties props;
    private final RestTemplate restTemplate;

    @Override
    public float[] generateEmbedding(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("待向量化文本不能为空");
        }
        OllamaEmbedResponse body = post(OllamaEmbedRequest.of(getModelName(), List.of(text)));
        float[] emb = body.getEmbedding(0);
        if (emb == null) {
            throw new UpstreamException("Ollama 未返回向量 model=" + getModelName());
        }
        checkDimension(emb);
        log.debug("[Embedding] Ollama 单条成功 dim={}", emb.length);
        return emb;
    }

    @Override
    public List<float[]> generateEmbeddings(List<String> texts) {
        if (texts == null || texts.isEmpty()) return List.of();
        for (String t : texts) {
            if (t == null || t.isBlank()) {
                throw new InvalidInputException("批量向量化中存在空文本");
            }
        }
        OllamaEmbedResponse body = post(OllamaEmbedRequest.of(getModelName(), texts));
        if (body.size() != texts.size()) {
            throw new UpstreamException("Ollama 返回向量数量不一致: 期望 " + texts.size() + ", 实际 " + body.size());
        }
        List<float[]> result = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            float[] emb = body.getEmbedding(i);
            if (emb == null) {
                throw new UpstreamException("Ollama 第 " + i + " 条向量为空");
            }
            checkDimension(emb);
            result.add(emb);
        }
        log.debug("[Embedding] Ollama 批量成功 count={}", result.size());
        return result;
    }

    @Override
    public boolean testConnection() {
        String url = buildUrl(OLLAMA_TAGS_PATH);
        try {
            OllamaTagsResponse tags = restTemplate.getForObject(url, OllamaTagsResponse.class);
            if (tags == null || tags.getModels() == null) {
                log.warn("[Embedding] 健康检查：/api/tags 无模型列表 url={}", url);
                return false;
            }
            String expected = getModelName().toLowerCase(Locale.ROOT);
            boolean found = tags.getModels().stream().anyMatch(m -> matchesModel(m, expected));
            if (!found) {
                log.warn("[Embedding] 健康检查：Ollama 未加载模型 {}，请先执行 ollama pull {}", getModelName(), getModelName());
            }
            return found;
        } catch (Exception e) {
            if (isInterruption(e)) Thread.currentThread().interrupt();
            log.warn("[Embedding] 健康检查失败 url={}: {}", url, e.getMessage());
            return false;
        }
    }

    @Override
    public String getModelName() {
        return props.getEmbeddingModel();
    }

    @Override
    public int getModelVersion() {
        return props.getEmbeddingModelVersion();
    }

    @Override
    public int getDimension() {
        return props.getEmbeddingDimensions();
    }

    private OllamaEmbedResponse post(OllamaEmbedRequest req) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("向量化请求在发送前已被中断");
        }
        String url = buildUrl(OLLAMA_EMBED_PATH);
        ResponseEntity<OllamaEmbedResponse> res;
        try {
            res = restTemplate.postForEntity(url, new HttpEntity<>(req, jsonHeaders()), OllamaEmbedResponse.class);
        } catch (RestClientException e) {
            if (isInterruption(e)) {
                Thread.currentThread().interrupt();
                CancellationException ce = new CancellationException("向量化请求被中断");
                ce.initCause(e);
                throw ce;
            }
            log.error("[Embedding] Ollama 调用失败 url={}, model={}", url, req.getModel(), e);
            throw new UpstreamException("Ollama 调用失败: " + e.getMessage(), e);
        }
        if (!res.getStatusCode().is2xxSuccessful() || res.getBody() == null) {
            throw new UpstreamException("Ollama 返回异常 status=" + res.getStatusCode());
        }
        return res.getBody();
    }

    private void checkDimension(float[] emb) {
        int expected = getDimension();
        if (expected <= 0 || emb.length == expected) return;
        if (props.isFailOnDimensionMismatch()) {
            throw new UpstreamException("向量维度不一致: 期望 " + expected + ", 实际 " + emb.length,
                    ProductSearchErrorCode.EMBEDDING_DIMENSION_MISMATCH);
        }
        log.warn("[Embedding] 向量维度与配置不一致: 期望 {}, 实际 {}, model={}", expected, emb.length, getModelName());
    }

    private static boolean matchesModel(OllamaTagsResponse.Model m, String expected) {
        String name = m.getName() != null ? m.getName() : m.getModel();
        return name != null && name.toLowerCase(Locale.ROOT).startsWith(expected);
    }

    private static boolean isInterruption(Throwable e) {
        if (Thread.currentThread().isInterrupted()) return true;
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException
                    || t instanceof ClosedByInterruptException
                    || (t instanceof InterruptedIOException && !(t instanceof SocketTimeoutException))) {
                return true;
            }
        }
        return false;
    }

    private String buildUrl(String path) {
        String base = props.getOllamaBaseUrl();
        if (base == null || base.isBlank()) base = "http://localhost:11434";
        return base.replaceAll("/$", "") + path;
    }

    private HttpHeaders jsonHeaders() {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        return h;
    }
}
