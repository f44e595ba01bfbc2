package it.autograph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import it.autograph.asn1.TreeWalker;
import it.autograph.config.AutographProperties;

@SpringBootApplication
@EnableConfigurationProperties(AutographProperties.class)
public class Autograph {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Autograph.class);
        app.setBanner((environment, sourceClass, out) -> { out.println("autograph - ASN.1 signature locator"); });
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Bean
    public TreeWalker treeWalker(AutographProperties properties) {
        AutographProperties.Decoder decoder = properties.getDecoder();
        return new TreeWalker(decoder.getMaxRecursionDepth(), decoder.getMaxElementsPerLevel());
    }
}
