package it.autograph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import it.autograph.asn1.TreeWalker;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@ConfigurationProperties(prefix = "autograph")
@Validated
@Getter
@Setter
public class AutographProperties {

    @Valid
    private Decoder decoder = new Decoder();
    @Valid
    private Output output = new Output();

    @Getter
    @Setter
    public static class Decoder {

        @Min(1)
        @Max(1_000)
        private int maxRecursionDepth = TreeWalker.DEFAULT_MAX_RECURSION_DEPTH;
        @Min(1)
        private int maxElementsPerLevel = TreeWalker.DEFAULT_MAX_ELEMENTS_PER_LEVEL;
    }

    @Getter
    @Setter
    public static class Output {

        @NotBlank
        private String defaultFile = "signature.der";
    }
}
