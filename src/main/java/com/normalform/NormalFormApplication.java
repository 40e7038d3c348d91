package com.normalform;

import com.normalform.cli.NormalFormCommand;
import com.normalform.cli.NormalFormRunner;
import com.normalform.core.NormalFormConverter;
import com.normalform.spring.EnableNormalForm;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command line application converting a sentence into simplified CNF or DNF.
 * <p>
 * Usage example:
 * <pre>
 * &gt; normal-form 'a =&gt; b &amp;&amp; c' dnf
 * ~a || (b &amp;&amp; c)
 * </pre>
 */
@SpringBootApplication
@EnableNormalForm
public class NormalFormApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(NormalFormApplication.class, args)));
    }

    @Bean
    public NormalFormRunner normalFormRunner(NormalFormConverter converter) {
        return new NormalFormRunner(new NormalFormCommand(converter, System.out, System.err));
    }
}
