package com.dubbi.hostmaster.config;

import com.dubbi.hostmaster.portal.protocol.ConfiguredErrorStatusText;
import com.dubbi.hostmaster.portal.protocol.ErrorClassifier;
import com.dubbi.hostmaster.portal.protocol.ErrorStatusText;
import com.dubbi.hostmaster.portal.protocol.ResultLineParser;
import com.dubbi.hostmaster.portal.session.CredentialLoader;
import com.dubbi.hostmaster.portal.session.LegacyEncoding;
import com.dubbi.hostmaster.portal.session.MutualTlsSessionFactory;
import com.dubbi.hostmaster.portal.session.PortalSessionFactory;
import com.dubbi.hostmaster.portal.traversal.RateLimiterFactory;
import com.dubbi.hostmaster.portal.web.FormTokenExtractor;
import com.dubbi.hostmaster.portal.web.MenuNavigator;
import com.dubbi.hostmaster.portal.web.TableExtractor;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ErrorCodeProperties.class)
public class PortalConfig {
    private static final Logger log = LoggerFactory.getLogger(PortalConfig.class);

    @Bean
    public PortalSettings portalSettings(
            @Value("${portal.base-url:https://iphostmaster.nic.ad.jp}") String baseUrl,
            @Value("${portal.menu-path:/jpnic/certmemberlogin.do}") String menuPath,
            @Value("${portal.transaction-path:/webtrans/WebRegisterCtl}") String transactionPath,
            @Value("${portal.pfx-path:}") String pfxPath,
            @Value("${portal.pfx-password:}") String pfxPassword,
            @Value("${portal.ca-path:}") String caPath,
            @Value("${portal.user-agent:Mozilla/5.0 (X11; Ubuntu; Linux x86_64; rv:91.0) Gecko/20100101 Firefox/91.0}") String userAgent,
            @Value("${portal.charset:" + LegacyEncoding.DEFAULT_CHARSET + "}") String charset,
            @Value("${portal.request-interval:1s}") Duration requestInterval,
            @Value("${portal.timeout:30s}") Duration timeout,
            @Value("${portal.workflow-timeout:5m}") Duration workflowTimeout
    ) {
        var settings = new PortalSettings(baseUrl, menuPath, transactionPath, pathOrNull(pfxPath), pfxPassword,
                pathOrNull(caPath), userAgent, charset, requestInterval, timeout, workflowTimeout);
        log.info("[Portal] {}", settings);
        return settings;
    }

    @Bean
    public LegacyEncoding legacyEncoding(PortalSettings settings) {
        return LegacyEncoding.of(settings.charset());
    }

    @Bean
    public PortalSessionFactory portalSessionFactory(PortalSettings settings, LegacyEncoding encoding) {
        return new MutualTlsSessionFactory(settings, new CredentialLoader(), encoding);
    }

    @Bean
    public ErrorStatusText errorStatusText(ErrorCodeProperties properties) {
        return new ConfiguredErrorStatusText(properties.codes());
    }

    @Bean
    public ErrorClassifier errorClassifier(ErrorStatusText errorStatusText) {
        return new ErrorClassifier(errorStatusText);
    }

    @Bean
    public ResultLineParser resultLineParser(ErrorClassifier errorClassifier) {
        return new ResultLineParser(errorClassifier);
    }

    @Bean
    public RateLimiterFactory rateLimiterFactory(PortalSettings settings) {
        return RateLimiterFactory.system(settings.requestInterval());
    }

    @Bean
    public MenuNavigator menuNavigator(PortalSettings settings) {
        return new MenuNavigator(settings.menuPath());
    }

    @Bean
    public FormTokenExtractor formTokenExtractor() {
        return new FormTokenExtractor();
    }

    @Bean
    public TableExtractor tableExtractor() {
        return new TableExtractor();
    }

    private static Path pathOrNull(String raw) {
        return raw == null || raw.isBlank() ? null : Path.of(raw);
    }
}
