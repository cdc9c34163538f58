package xyz.firestige.rollout.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollout.domain.deployment.HealthCheckConfig;
import xyz.firestige.rollout.domain.deployment.HealthCheckRecord;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * HTTP 探测走 RestTemplate（比较期望状态码），TCP 探测直接建连
 * EXEC / GRPC 探测需要编排平台配合，这里记为通过并注明跳过
 */
public class RestTemplateHealthCheckClient implements HealthCheckClient {

    private static final Logger log = LoggerFactory.getLogger(RestTemplateHealthCheckClient.class);

    private final RestTemplate restTemplate;
    private final Duration connectTimeout;

    public RestTemplateHealthCheckClient(RestTemplate restTemplate, Duration connectTimeout) {
        this.restTemplate = restTemplate;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public HealthCheckRecord probe(HealthCheckConfig check) {
        switch (check.getType()) {
            case HTTP:
                return probeHttp(check);
            case TCP:
                return probeTcp(check);
            default:
                log.debug("[HealthCheck] 探测类型 {} 不在本地执行: {}", check.getType(), check.getEndpoint());
                return HealthCheckRecord.passed(check, "skipped: " + check.getType());
        }
    }

    private HealthCheckRecord probeHttp(HealthCheckConfig check) {
        HttpHeaders headers = new HttpHeaders();
        check.getHeaders().forEach(headers::set);
        int status;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    check.getEndpoint(), HttpMethod.GET, new HttpEntity<>(headers), String.class);
            status = response.getStatusCode().value();
        } catch (HttpStatusCodeException e) {
            status = e.getStatusCode().value();
        } catch (RestClientException e) {
            log.warn("[HealthCheck] HTTP 探测异常: {} - {}", check.getEndpoint(), e.getMessage());
            return HealthCheckRecord.failed(check, e.getMessage());
        }

        if (status == check.getExpectedStatus()) {
            return HealthCheckRecord.passed(check, "status=" + status);
        }
        log.warn("[HealthCheck] HTTP 状态码不符: {} 期望 {} 实际 {}", check.getEndpoint(), check.getExpectedStatus(), status);
        return HealthCheckRecord.failed(check, "status=" + status + ", expected=" + check.getExpectedStatus());
    }

    private HealthCheckRecord probeTcp(HealthCheckConfig check) {
        String endpoint = check.getEndpoint();
        int idx = endpoint.lastIndexOf(':');
        if (idx <= 0 || idx == endpoint.length() - 1) {
            return HealthCheckRecord.failed(check, "invalid tcp endpoint: " + endpoint);
        }
        String host = endpoint.substring(0, idx);
        int port;
        try {
            port = Integer.parseInt(endpoint.substring(idx + 1));
        } catch (NumberFormatException e) {
            return HealthCheckRecord.failed(check, "invalid tcp port: " + endpoint);
        }

        int timeoutMillis = (int) Math.min(connectTimeout.toMillis(), check.getTimeoutSeconds() * 1000L);
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            return HealthCheckRecord.passed(check, "connected");
        } catch (IOException e) {
            log.warn("[HealthCheck] TCP 探测失败: {} - {}", endpoint, e.getMessage());
            return HealthCheckRecord.failed(check, e.getMessage());
        }
    }
}
