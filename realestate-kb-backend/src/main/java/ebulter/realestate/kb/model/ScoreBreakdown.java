package ebulter.realestate.kb.model;

/**
 * Per-component credit in [0, 1]; null when the client did not state that preference
 */
public class ScoreBreakdown {
    private final Double priceFit;
    private final Double bedroomFit;
    private final Double areaMatch;
    private final Double typeMatch;

    public ScoreBreakdown(Double priceFit, Double bedroomFit, Double areaMatch, Double typeMatch) {
        this.priceFit = priceFit;
        this.bedroomFit = bedroomFit;
        this.areaMatch = areaMatch;
        this.typeMatch = typeMatch;
    }

    public Double getPriceFit() { return priceFit; }

    public Double getBedroomFit() { return bedroomFit; }

    public Double getAreaMatch() { return areaMatch; }

    public Double getTypeMatch() { return typeMatch; }

    @Override
    public String toString() {
        return "ScoreBreakdown{price=" + priceFit + ", bedrooms=" + bedroomFit
                + ", area=" + areaMatch + ", type=" + typeMatch + "}";
    }
}
