/**
 * LanguageModelConfig.java
 * Language Model Toolkit
 *
 * Description: Settings shared by the language models and preprocessing,
 * read from the classpath resource langmodel.properties.
 *
 *      lm.order               n-gram order (default 3)
 *      lm.unk.cutoff          minimum count for a word to be in the vocabulary (default 1)
 *      lm.unk.label           label for out-of-vocabulary words (default <UNK>)
 *      lm.pad.left            sentence start symbol (default <s>)
 *      lm.pad.right           sentence end symbol (default </s>)
 *      lm.lidstone.gamma      additive constant for Lidstone (default 0.1)
 *      lm.absolute.discount   discount for absolute discounting (default 0.75)
 *      lm.kneserney.discount  discount for Kneser-Ney (default 0.1)
 *      lm.random.seed         seed for generation; unset means unseeded
 */

package org.utd.cs.langmodel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.utd.cs.langmodel.probability.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.Random;

public class LanguageModelConfig {
    private static final Logger logger = LoggerFactory.getLogger(LanguageModelConfig.class);

    public static final String RESOURCE = "langmodel.properties";

    private final int order;
    private final int unkCutoff;
    private final String unkLabel;
    private final String padLeft;
    private final String padRight;
    private final double lidstoneGamma;
    private final double absoluteDiscount;
    private final double kneserNeyDiscount;
    private final Long randomSeed;

    private LanguageModelConfig(Properties props) {
        this.order = intProperty(props, "lm.order", 3);
        this.unkCutoff = intProperty(props, "lm.unk.cutoff", 1);
        this.unkLabel = props.getProperty("lm.unk.label", CountingVocabulary.DEFAULT_UNK_LABEL).trim();
        this.padLeft = props.getProperty("lm.pad.left", NgramPreprocessing.DEFAULT_PAD_LEFT).trim();
        this.padRight = props.getProperty("lm.pad.right", NgramPreprocessing.DEFAULT_PAD_RIGHT).trim();
        this.lidstoneGamma = doubleProperty(props, "lm.lidstone.gamma", 0.1);
        this.absoluteDiscount = doubleProperty(props, "lm.absolute.discount", 0.75);
        this.kneserNeyDiscount = doubleProperty(props, "lm.kneserney.discount", 0.1);

        String seed = props.getProperty("lm.random.seed");
        if (seed == null || seed.isBlank()) {
            this.randomSeed = null;
        } else {
            try {
                this.randomSeed = Long.parseLong(seed.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("lm.random.seed is not a number: " + seed, e);
            }
        }

        if (order < 1) throw new ConfigurationException("lm.order must be at least 1, got " + order);
        if (unkCutoff < 1) throw new ConfigurationException("lm.unk.cutoff must be at least 1, got " + unkCutoff);
        if (unkLabel.isEmpty()) throw new ConfigurationException("lm.unk.label must not be empty");
    }

    /** Reads langmodel.properties from the classpath. */
    public static LanguageModelConfig load() {
        return load(RESOURCE);
    }

    public static LanguageModelConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream input = LanguageModelConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {throw new ConfigurationException("Language model config file not found: " + resource);}
            props.load(input);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read language model config " + resource, e);
        }

        LanguageModelConfig config = new LanguageModelConfig(props);
        logger.info("Loaded language model config from {}: order={}, unkCutoff={}", resource, config.order, config.unkCutoff);
        return config;
    }

    /** Builds a config from explicit properties; absent keys take their defaults. */
    public static LanguageModelConfig fromProperties(Properties props) {
        return new LanguageModelConfig(props);
    }

    public static LanguageModelConfig defaults() {
        return new LanguageModelConfig(new Properties());
    }

    private static int intProperty(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }

    private static double doubleProperty(Properties props, String key, double fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) return fallback;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: " + value, e);
        }
    }

    public int getOrder() {
        return order;
    }

    public int getUnkCutoff() {
        return unkCutoff;
    }

    public String getUnkLabel() {
        return unkLabel;
    }

    public String getPadLeft() {
        return padLeft;
    }

    public String getPadRight() {
        return padRight;
    }

    public double getLidstoneGamma() {
        return lidstoneGamma;
    }

    public double getAbsoluteDiscount() {
        return absoluteDiscount;
    }

    public double getKneserNeyDiscount() {
        return kneserNeyDiscount;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    /** A Random seeded from lm.random.seed, or an unseeded one. */
    public Random newRandom() {
        return (randomSeed == null) ? new Random() : new Random(randomSeed);
    }

    /** An empty vocabulary with this config's cutoff and label. */
    public CountingVocabulary newVocabulary() {
        return new CountingVocabulary(unkCutoff, unkLabel);
    }
}
