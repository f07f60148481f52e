package uk.gegc.accounting.features.pricing.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import uk.gegc.accounting.features.pricing.application.PricingFunction;
import uk.gegc.accounting.features.pricing.application.PricingProperties;
import uk.gegc.accounting.features.pricing.domain.model.TokenKind;
import uk.gegc.accounting.shared.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Table-driven pricing. Costs are computed exactly in decimal and rounded up to whole credits,
 * so any non-zero usage on a priced model costs at least one credit.
 */
@Service
public class ModelPricingTable implements PricingFunction {

    private static final Logger log = LoggerFactory.getLogger(ModelPricingTable.class);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final Map<String, PricingProperties.ModelRate> ratesByModel;
    private final PricingProperties.Rate defaultRate;

    public ModelPricingTable(PricingProperties properties) {
        this.ratesByModel = properties.getModels().stream()
                .collect(Collectors.toUnmodifiableMap(PricingProperties.ModelRate::getModelId, Function.identity()));
        this.defaultRate = properties.getDefaultRate();
    }

    @Override
    public long creditsFor(String modelId, long tokens, TokenKind kind) {
        if (tokens < 0) {
            throw new InvalidAmountException("Token count must be non-negative");
        }
        if (tokens == 0) {
            return 0L;
        }

        BigDecimal input;
        BigDecimal output;
        PricingProperties.ModelRate rate = modelId != null ? ratesByModel.get(modelId) : null;
        if (rate != null) {
            input = rate.getInputPer1k();
            output = rate.getOutputPer1k();
        } else {
            log.debug("No rate configured for model '{}', using default rate", modelId);
            input = defaultRate.getInputPer1k();
            output = defaultRate.getOutputPer1k();
        }

        BigDecimal count = BigDecimal.valueOf(tokens);
        BigDecimal cost = switch (kind) {
            case INPUT -> count.multiply(input).divide(THOUSAND);
            case OUTPUT -> count.multiply(output).divide(THOUSAND);
            case BOTH -> count.multiply(input.add(output)).divide(THOUSAND.multiply(TWO));
        };
        return cost.setScale(0, RoundingMode.CEILING).longValueExact();
    }
}
