package io.pricelake.financial.fetch;

import java.io.IOException;

/**
 * Raw access to the Yahoo Finance v8 chart endpoint; returns the JSON body.
 */
public interface YahooClient {
    String fetch(String ticker, long period1, long period2, String interval) throws IOException, InterruptedException;
}
