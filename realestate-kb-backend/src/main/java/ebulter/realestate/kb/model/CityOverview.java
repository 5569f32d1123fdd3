package ebulter.realestate.kb.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * City-wide facts kept at the top level of the areas document, next to the areas array.
 * Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CityOverview {
    private static final CityOverview EMPTY = new CityOverview();

    @JsonProperty("city_name")
    private String cityName;

    @JsonProperty("state")
    private String state;

    @JsonProperty("population")
    private Long population;

    @JsonProperty("median_income")
    private Long medianIncome;

    @JsonProperty("school_districts")
    private List<String> schoolDistricts;

    @JsonProperty("market_trends")
    private Map<String, Object> marketTrends;

    private CityOverview() {}

    public CityOverview(String cityName, String state, Long population, Long medianIncome,
                        List<String> schoolDistricts, Map<String, Object> marketTrends) {
        this.cityName = cityName;
        this.state = state;
        this.population = population;
        this.medianIncome = medianIncome;
        this.schoolDistricts = schoolDistricts == null ? null : new ArrayList<>(schoolDistricts);
        this.marketTrends = marketTrends == null ? null : new LinkedHashMap<>(marketTrends);
    }

    public static CityOverview empty() {
        return EMPTY;
    }

    public String getCityName() { return cityName; }

    public String getState() { return state; }

    public Long getPopulation() { return population; }

    public Long getMedianIncome() { return medianIncome; }

    public List<String> getSchoolDistricts() {
        return schoolDistricts == null ? List.of() : Collections.unmodifiableList(schoolDistricts);
    }

    public Map<String, Object> getMarketTrends() {
        return marketTrends == null ? Map.of() : Collections.unmodifiableMap(marketTrends);
    }
}
