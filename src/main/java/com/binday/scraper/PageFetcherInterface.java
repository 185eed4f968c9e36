package com.binday.scraper;

/**
 * Interface for obtaining the collection results page for one household.
 */
public interface PageFetcherInterface {
    /**
     * Fills in the council's collection-day form and returns the fully loaded results page.
     * @param postcode household postcode as typed into the form
     * @param addressLine address exactly (or nearly) as listed in the address dropdown
     * @return results page HTML
     * @throws PageFetchException if the form cannot be completed or the results never appear
     */
    String fetchResultsHtml(String postcode, String addressLine);
}
