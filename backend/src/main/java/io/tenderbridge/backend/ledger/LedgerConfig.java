package io.tenderbridge.backend.ledger;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnProperty(name = "tenderbridge.ledger.provider", havingValue = "web3j")
  public Web3j web3j(LedgerProperties properties) {
    return Web3j.build(new HttpService(properties.chain().rpcUrl()));
  }
}
