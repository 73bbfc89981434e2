package com.coinbase.x402quote.server;

import com.coinbase.x402quote.model.PaymentRequirementsTemplate;

import java.net.URI;
import java.util.List;

/** Decides, per request, which payment requirements apply to a protected route. */
public interface PaymentRequirementsResolver {
    /**
     * @param request the incoming request
     * @param baseUrl public base URL of the server, used to build the resource URL
     * @param templates the route's requirement templates
     * @return finalized requirements, or a payment-required result with the nominal requirements
     * @throws com.coinbase.x402quote.model.InvalidAmountException if a finalized amount cannot be represented
     */
    Resolution resolve(RequestContext request, URI baseUrl, List<PaymentRequirementsTemplate> templates);
}
