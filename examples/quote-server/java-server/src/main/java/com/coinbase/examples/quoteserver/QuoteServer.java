package com.coinbase.examples.quoteserver;

import com.coinbase.x402quote.client.FacilitatorClient;
import com.coinbase.x402quote.client.HttpFacilitatorClient;
import com.coinbase.x402quote.model.InvalidAmountException;
import com.coinbase.x402quote.model.MoneyAmount;
import com.coinbase.x402quote.model.PaymentRequirementsTemplate;
import com.coinbase.x402quote.model.TokenDeployment;
import com.coinbase.x402quote.quote.DuplicateQuoteIdException;
import com.coinbase.x402quote.quote.ExpiryReaper;
import com.coinbase.x402quote.quote.InMemoryQuoteStore;
import com.coinbase.x402quote.quote.IssuedQuote;
import com.coinbase.x402quote.quote.QuoteIssuer;
import com.coinbase.x402quote.quote.QuoteRequirementsResolver;
import com.coinbase.x402quote.quote.QuoteStore;
import com.coinbase.x402quote.server.PaymentGate;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Example server with dynamic pricing: clients ask {@code POST /quote} for a price,
 * then pay exactly that price for {@code GET /resource} by presenting the quote id.
 *
 * <p>Callers are identified by the {@code X-Client-Id} header, which nothing authenticates.
 */
public class QuoteServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QuoteServer.class);

    private static final Map<String, String> INTERNAL_ERROR = Map.of("error", "Internal server error");
    private static final Map<String, String> FACILITATOR_UNAVAILABLE = Map.of("error", "Facilitator unavailable");

    private final QuoteServerConfig config;
    private final QuoteIssuer issuer;
    private final QuotePricer pricer;
    private final ExpiryReaper reaper;
    private final Javalin app;

    public QuoteServer(QuoteServerConfig config, FacilitatorClient facilitator, Clock clock) {
        this.config = config;

        QuoteStore store = new InMemoryQuoteStore();
        this.issuer = new QuoteIssuer(store, clock);
        this.pricer = new PerFilePricer(config.unitPrice());
        this.reaper = new ExpiryReaper(store, clock, config.reaperPeriod());

        // the nominal price is what clients see until they present a quote
        PaymentRequirementsTemplate usdc = TokenDeployment.usdc(config.network())
                .template(config.payTo(), config.nominalPrice())
                .withDescription("Quoted resource")
                .withMimeType("application/json");
        PaymentGate gate = new PaymentGate(facilitator,
                new QuoteRequirementsResolver(store, clock),
                config.baseUrl(),
                List.of(usdc));
        X402Middleware x402 = new X402Middleware(gate);

        this.app = Javalin.create(javalin -> javalin.showJavalinBanner = false);
        app.post("/quote", this::quote);
        app.get("/resource", x402.protect(this::resource));

        app.exception(InvalidAmountException.class, (e, ctx) -> {
            logger.error("Quoted amount could not be finalized for {}", ctx.path(), e);
            ctx.status(500).json(INTERNAL_ERROR);
        });
        app.exception(DuplicateQuoteIdException.class, (e, ctx) -> {
            logger.error("Quote id generation collided twice", e);
            ctx.status(500).json(INTERNAL_ERROR);
        });
        app.exception(IOException.class, (e, ctx) -> {
            logger.error("Facilitator call failed for {}", ctx.path(), e);
            ctx.status(502).json(FACILITATOR_UNAVAILABLE);
        });
    }

    public QuoteServer start() {
        reaper.start();
        app.start(config.port());
        logger.info("Listening on {} (base URL {}, network {})", app.port(), config.baseUrl(), config.network().id());
        return this;
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return app.port();
    }

    /** POST /quote */
    private void quote(Context ctx) {
        QuoteRequest request = ctx.bodyValidator(QuoteRequest.class)
                .check(r -> r.numberOfFiles > 0, "number_of_files must be positive")
                .get();
        String clientId = QuoteRequirementsResolver.clientIdOf(X402Middleware.requestContext(ctx));
        MoneyAmount price = pricer.price(request);

        IssuedQuote quote = issuer.issue(price, clientId, config.quoteTtl());
        logger.info("Quoted {} for {} files to {}", quote.getAmount(), request.numberOfFiles, clientId);
        ctx.json(quote);
    }

    /** GET /resource */
    private void resource(Context ctx) {
        ctx.json(Map.of("ok", true));
    }

    @Override
    public void close() {
        reaper.close();
        app.stop();
    }

    public static void main(String[] args) {
        QuoteServerConfig config = QuoteServerConfig.fromEnv(System.getenv());
        QuoteServer server = new QuoteServer(config,
                new HttpFacilitatorClient(config.facilitatorUrl()),
                Clock.systemUTC()).start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "x402-quote-shutdown"));
    }
}
