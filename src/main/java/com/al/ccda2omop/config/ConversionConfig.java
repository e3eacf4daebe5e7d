package com.al.ccda2omop.config;

import com.al.ccda2omop.exception.RuleLoadException;
import com.al.ccda2omop.service.rule.RuleLoader;
import com.al.ccda2omop.service.rule.RuleSet;
import com.al.ccda2omop.service.vocabulary.StandardConcepts;
import com.al.ccda2omop.service.vocabulary.VocabularyIndex;
import com.al.ccda2omop.service.vocabulary.VocabularyLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads the vocabulary and the mapping rules once at startup. Both are
 * read-only after construction and shared by all conversions.
 */
@Configuration
@Slf4j
public class ConversionConfig {

    static final String BUNDLED_RULES = "classpath:rules/*.y*ml";

    @Bean
    public VocabularyIndex vocabularyIndex(ConversionProperties properties) {
        if (isBlank(properties.getConceptFile())) {
            log.info("No concept file configured, concept lookups will return 0");
            return VocabularyIndex.empty();
        }
        VocabularyLoader loader = new VocabularyLoader();
        loader.loadConcepts(Path.of(properties.getConceptFile()));
        if (!isBlank(properties.getRelationshipFile())) {
            loader.loadRelationships(Path.of(properties.getRelationshipFile()));
        }
        if (!isBlank(properties.getVocabDir())) {
            loader.loadSupplementaryDirectory(Path.of(properties.getVocabDir()));
        }
        return loader.build();
    }

    @Bean
    public StandardConcepts standardConcepts(VocabularyIndex vocabularyIndex) {
        return new StandardConcepts(vocabularyIndex);
    }

    @Bean
    public RuleSet ruleSet(ConversionProperties properties, RuleLoader ruleLoader,
            ResourcePatternResolver resourceResolver) {
        if (!isBlank(properties.getRulesPath())) {
            return RuleSet.of(ruleLoader.load(Path.of(properties.getRulesPath())));
        }
        try {
            Resource[] resources = resourceResolver.getResources(BUNDLED_RULES);
            return RuleSet.of(ruleLoader.load(resources));
        } catch (IOException e) {
            throw new RuleLoadException("Cannot list bundled rules", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
