package com.coinbase.x402quote.quote;

import com.coinbase.x402quote.model.MoneyAmount;
import com.coinbase.x402quote.model.PaymentRequirements;
import com.coinbase.x402quote.model.PaymentRequirementsTemplate;
import com.coinbase.x402quote.server.PaymentRequirementsResolver;
import com.coinbase.x402quote.server.RequestContext;
import com.coinbase.x402quote.server.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Resolves payment requirements from a quote presented in {@code X-Quote-Id}.
 *
 * <p>A valid quote is consumed and its amount becomes the required amount. Every other
 * case (no quote, unknown, expired, issued to another caller, already used) yields the
 * same payment-required result with the nominal requirements; the cause is only logged.
 *
 * <p>The caller is identified by the unauthenticated {@code X-Client-Id} header, so any
 * client that knows a quote id and its owner's id can spend it.
 */
public class QuoteRequirementsResolver implements PaymentRequirementsResolver {

    private static final Logger logger = LoggerFactory.getLogger(QuoteRequirementsResolver.class);

    public static final String QUOTE_ID_HEADER = "X-Quote-Id";
    public static final String CLIENT_ID_HEADER = "X-Client-Id";
    public static final String UNKNOWN_CLIENT = "unknown";

    private final QuoteStore store;
    private final Clock clock;

    public QuoteRequirementsResolver(QuoteStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Caller id from {@code X-Client-Id}, or {@value #UNKNOWN_CLIENT} when absent. */
    public static String clientIdOf(RequestContext request) {
        String clientId = request.header(CLIENT_ID_HEADER);
        return clientId == null || clientId.isBlank() ? UNKNOWN_CLIENT : clientId.trim();
    }

    @Override
    public Resolution resolve(RequestContext request, URI baseUrl, List<PaymentRequirementsTemplate> templates) {
        return resolve(request, baseUrl, templates, clock.instant());
    }

    /**
     * @throws com.coinbase.x402quote.model.InvalidAmountException if the quoted amount cannot be
     *         expressed in a template asset's base units; the quote stays consumed
     */
    public Resolution resolve(RequestContext request, URI baseUrl,
                              List<PaymentRequirementsTemplate> templates, Instant now) {
        URI resource = request.resourceUrl(baseUrl);

        String header = request.header(QUOTE_ID_HEADER);
        if (header == null || header.isBlank()) {
            logger.debug("No quote presented for {}", resource);
            return Resolution.paymentRequired(nominal(templates, resource));
        }

        String quoteId = header.trim();
        String clientId = clientIdOf(request);
        QuoteRecord quote;
        try {
            quote = store.tryConsume(quoteId, clientId, now);
        } catch (QuoteRejectedException e) {
            logger.info("Quote rejected: quoteId={} clientId={} resource={} reason={}",
                    quoteId, clientId, resource, e.getReason());
            return Resolution.paymentRequired(nominal(templates, resource));
        }

        MoneyAmount amount = MoneyAmount.parse(quote.getAmount());
        List<PaymentRequirements> finalized = new ArrayList<>(templates.size());
        for (PaymentRequirementsTemplate template : templates) {
            PaymentRequirements req = template.toPaymentRequirements(resource);
            req.maxAmountRequired = amount.toTokenAmount(template.getAssetDecimals());
            req.scheme = PaymentRequirementsTemplate.EXACT_SCHEME;
            finalized.add(req);
        }
        logger.info("Quote consumed: quoteId={} clientId={} resource={} amount={}",
                quoteId, clientId, resource, quote.getAmount());
        return Resolution.finalized(finalized);
    }

    private static List<PaymentRequirements> nominal(List<PaymentRequirementsTemplate> templates, URI resource) {
        return templates.stream()
                .map(t -> t.toPaymentRequirements(resource))
                .collect(Collectors.toList());
    }
}
