package com.sentinel.ingest;


import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.sentinel.common.adapter.InMemoryBus;
import com.sentinel.common.dto.LogEvent;
import com.sentinel.common.port.LogSource;
import com.sentinel.common.port.MessageBus;
import com.sentinel.ingest.docker.DockerLogSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.*;


@Configuration
public class IngestConfig {
@Bean public MessageBus<LogEvent> logBus() { return new InMemoryBus<>(); }

@Bean(destroyMethod = "close")
public DockerClient dockerClient(@Value("${sentinel.docker-host:}") String host,
                                 @Value("${sentinel.docker-port:2375}") int port,
                                 @Value("${sentinel.docker-socket:/var/run/docker.sock}") String socket) {
    DockerClientConfig config = DefaultDockerClientConfig.createDefaultConfigBuilder()
            .withDockerHost(dockerEndpoint(host, port, socket))
            .build();
    ApacheDockerHttpClient http = new ApacheDockerHttpClient.Builder()
            .dockerHost(config.getDockerHost())
            .sslConfig(config.getSSLConfig())
            .build();
    return DockerClientImpl.getInstance(config, http);
}

@Bean public LogSource logSource(DockerClient docker) { return new DockerLogSource(docker); }

/** A remote host (plain or with scheme) wins over the local socket. */
static String dockerEndpoint(String host, int port, String socket) {
    if (host == null || host.isBlank()) return "unix://" + socket;
    if (host.contains("://")) return host;
    return "tcp://" + host + ":" + port;
}
}
