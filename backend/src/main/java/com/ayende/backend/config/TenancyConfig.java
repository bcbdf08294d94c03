package com.ayende.backend.config;

import com.ayende.backend.core.tenant.SubdomainParser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.List;

@Configuration
@EnableScheduling
public class TenancyConfig {

    @Bean
    public SubdomainParser subdomainParser(@Value("${ayende.tenancy.platform-hosts}") List<String> platformHosts,
                                           @Value("${ayende.tenancy.wildcard-domains}") List<String> wildcardDomains) {
        return new SubdomainParser(platformHosts, wildcardDomains);
    }
}
