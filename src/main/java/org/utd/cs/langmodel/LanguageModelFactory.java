/**
 * LanguageModelFactory.java
 * Language Model Toolkit
 *
 * Description: Builds a language model from its name, taking the smoothing
 * parameters from the configuration.
 *
 * Supported models:
 *    - "mle"                  -> MLE
 *    - "lidstone"             -> Lidstone (lm.lidstone.gamma)
 *    - "laplace"              -> Laplace
 *    - "witten_bell"          -> WittenBellInterpolated
 *    - "absolute_discounting" -> AbsoluteDiscountingInterpolated (lm.absolute.discount)
 *    - "kneser_ney"           -> KneserNeyInterpolated (lm.kneserney.discount)
 */

package org.utd.cs.langmodel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.utd.cs.langmodel.probability.ConfigurationException;

import java.util.List;
import java.util.Locale;

public class LanguageModelFactory {
    private static final Logger logger = LoggerFactory.getLogger(LanguageModelFactory.class);

    public static final List<String> MODEL_NAMES = List.of(
            "mle", "lidstone", "laplace", "witten_bell", "absolute_discounting", "kneser_ney");

    private LanguageModelFactory() {}

    /** A model of the configured order with a fresh vocabulary from the config. */
    public static LanguageModel create(String name, LanguageModelConfig config) {
        return create(name, config.getOrder(), config.newVocabulary(), config);
    }

    public static LanguageModel create(String name, int order, Vocabulary vocabulary, LanguageModelConfig config) {
        if (name == null) throw new ConfigurationException("Model name must not be null");

        LanguageModel model;
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "mle":
                model = new MLE(order, vocabulary);
                break;
            case "lidstone":
                model = new Lidstone(config.getLidstoneGamma(), order, vocabulary);
                break;
            case "laplace":
                model = new Laplace(order, vocabulary);
                break;
            case "witten_bell":
                model = new WittenBellInterpolated(order, vocabulary);
                break;
            case "absolute_discounting":
                model = new AbsoluteDiscountingInterpolated(order, config.getAbsoluteDiscount(), vocabulary);
                break;
            case "kneser_ney":
                model = new KneserNeyInterpolated(order, config.getKneserNeyDiscount(), vocabulary);
                break;
            default:
                throw new ConfigurationException("Unknown language model '" + name + "'; expected one of " + MODEL_NAMES);
        }

        model.setRandom(config.newRandom());
        logger.debug("Created {} of order {}", model.getName(), order);
        return model;
    }
}
