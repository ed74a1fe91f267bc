package fr.imt.pbdeployer.configuration;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;

// fills @CreatedDate and @LastModifiedDate on servers, apps and versions
@Configuration
@EnableMongoAuditing
public class MongoConfiguration {
}
