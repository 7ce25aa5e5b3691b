package world.willfrog.tracefetch.fetch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import world.willfrog.tracefetch.fetch.service.ProjectIdCache;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class FetchClientConfig {

    @Bean
    public HttpClient traceHttpClient(TraceFetchProperties properties) {
        int connectTimeout = properties.getHttp().getConnectTimeoutSeconds();
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(connectTimeout > 0 ? connectTimeout : 20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 项目名 -> UUID 的进程级缓存，只解析一次。
     */
    @Bean
    public ProjectIdCache projectIdCache() {
        return new ProjectIdCache();
    }
}
