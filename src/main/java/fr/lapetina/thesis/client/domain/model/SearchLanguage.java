package fr.lapetina.thesis.client.domain.model;

/**
 * Language of a literature search, selecting the databases queried.
 */
public enum SearchLanguage {
    CHINESE("CJFD,CDFD,CMFD,CPFD,CCND,IPFD,CAPJ"),
    ENGLISH("WWJD,WWPD");

    private final String products;

    SearchLanguage(String products) {
        this.products = products;
    }

    /**
     * Comma-separated product codes sent with the query.
     */
    public String getProducts() {
        return products;
    }
}
