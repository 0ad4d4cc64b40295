package com.flamingo.ai.docsearch.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.HttpHost;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch client for the chunk index, on the HttpComponents 5 transport of ES 9.
 *
 * <p>Only created when chunks are kept in Elasticsearch. The low-level client applies its default
 * connect (1s) and socket (30s) timeouts.
 */
@Configuration
@ConditionalOnProperty(
    name = "rag.index-store.type",
    havingValue = "elasticsearch",
    matchIfMissing = true)
@Slf4j
public class ElasticsearchConfig {

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client(
      @Value("${elasticsearch.scheme:http}") String scheme,
      @Value("${elasticsearch.host:localhost}") String host,
      @Value("${elasticsearch.port:9200}") int port) {
    log.info("Chunk index store: Elasticsearch at {}://{}:{}", scheme, host, port);
    return Rest5Client.builder(new HttpHost(scheme, host, port)).build();
  }

  /**
   * Transport sharing Spring's Jackson setup. The mapper is copied because the client reconfigures
   * null handling on the instance it receives.
   */
  @Bean
  public ElasticsearchTransport elasticsearchTransport(
      Rest5Client rest5Client, ObjectMapper objectMapper) {
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper(objectMapper.copy()));
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }
}
