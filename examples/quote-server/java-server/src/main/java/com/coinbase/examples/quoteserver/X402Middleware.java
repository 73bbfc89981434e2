package com.coinbase.examples.quoteserver;

import com.coinbase.x402quote.model.SettlementResponseHeader;
import com.coinbase.x402quote.server.GateDecision;
import com.coinbase.x402quote.server.PaymentGate;
import com.coinbase.x402quote.server.RequestContext;
import io.javalin.http.Context;
import io.javalin.http.Handler;

/** Wraps Javalin handlers so they only run for requests carrying a verified x402 payment. */
public class X402Middleware {

    private static final int PAYMENT_REQUIRED = 402;

    private final PaymentGate gate;

    public X402Middleware(PaymentGate gate) {
        this.gate = gate;
    }

    /** Returns a handler that serves {@code resource} after payment and settles afterwards. */
    public Handler protect(Handler resource) {
        return ctx -> handle(ctx, resource);
    }

    private void handle(Context ctx, Handler resource) throws Exception {
        GateDecision decision = gate.authorize(requestContext(ctx));
        if (!decision.isAdmitted()) {
            ctx.status(PAYMENT_REQUIRED).json(decision.getRejection());
            return;
        }

        resource.handle(ctx);

        SettlementResponseHeader settlement = gate.settle(decision);
        if (!settlement.success) {
            ctx.status(PAYMENT_REQUIRED).json(gate.settlementFailed(decision, settlement));
            return;
        }
        ctx.header(PaymentGate.PAYMENT_RESPONSE_HEADER, settlement.toHeader());
    }

    static RequestContext requestContext(Context ctx) {
        return new RequestContext(ctx.headerMap(), ctx.path(), ctx.queryString());
    }
}
