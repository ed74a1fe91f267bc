package fr.imt.pbdeployer.configuration;

import fr.imt.pbdeployer.exception.AuthenticationException;
import fr.imt.pbdeployer.exception.ConnectionException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfiguration {

    /**
     * Retry policy for opening SSH sessions. Remote commands are never retried.
     */
    @Bean
    public RetryTemplate sshRetryTemplate(PbDeployerProperties properties) {
        PbDeployerProperties.Ssh ssh = properties.getSsh();
        return RetryTemplate.builder()
                .maxAttempts(ssh.getConnectAttempts())
                .customBackoff(new LinearBackOffPolicy(ssh.getRetryBackoff().toMillis()))
                .retryOn(ConnectionException.class)
                .retryOn(AuthenticationException.class)
                .build();
    }
}
