package com.coinbase.examples.quoteserver;

import com.fasterxml.jackson.annotation.JsonProperty;

/** JSON body of POST /quote. */
public class QuoteRequest {
    /** Input that drives the price. */
    @JsonProperty("number_of_files")
    public int numberOfFiles;

    /** Default constructor for Jackson. */
    public QuoteRequest() {}

    public QuoteRequest(int numberOfFiles) {
        this.numberOfFiles = numberOfFiles;
    }
}
