package com.williamcallahan.specweave.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.specweave.service.SpecCompiler;
import com.williamcallahan.specweave.service.biblio.BiblioJsonCodec;
import com.williamcallahan.specweave.service.grammar.GrammarEngine;
import com.williamcallahan.specweave.service.grammar.SimpleGrammarEngine;
import com.williamcallahan.specweave.service.imports.FileImportLoader;
import com.williamcallahan.specweave.service.imports.ImportLoader;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the compiler and its collaborators.
 */
@Configuration
public class CompilerConfig {

    @Bean
    @ConditionalOnMissingBean
    public ImportLoader importLoader() {
        return new FileImportLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    public GrammarEngine grammarEngine() {
        return new SimpleGrammarEngine();
    }

    @Bean
    public BiblioJsonCodec biblioJsonCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new BiblioJsonCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public SpecCompiler specCompiler(CompilerProperties properties, GrammarEngine grammarEngine,
                                     ImportLoader importLoader, BiblioJsonCodec biblioJsonCodec) {
        return new SpecCompiler(properties.toCompilerOptions(), grammarEngine, importLoader, biblioJsonCodec);
    }
}
