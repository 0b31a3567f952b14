package com.lead.discovery.matching;

import com.lead.discovery.core.model.ConfidenceLevel;
import com.lead.discovery.core.model.Lead;
import com.lead.discovery.core.model.LeadType;
import com.lead.discovery.core.model.Priority;
import com.lead.discovery.core.model.ServiceOffering;
import com.lead.discovery.core.model.TargetAudience;
import com.lead.discovery.geo.StateAbbreviations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-factor lead-to-service scorer.
 * Formula: score = wg*geographic + wi*industry + wn*need + wp*profile + wb*behavioral
 *
 * <p>Industry and need never drop to zero (floors of 30 and 40) and the profile score only
 * ever moves down from 100, the lowest violation winning. Missing lead data yields the
 * neutral value of each component instead of an error.</p>
 */
public class MatchingAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(MatchingAlgorithm.class);

    static final Set<String> NATIONWIDE = Set.of("nationwide", "national", "global", "all");

    private final MatchingWeights weights;

    public MatchingAlgorithm() {
        this(MatchingWeights.defaultWeights());
    }

    public MatchingAlgorithm(MatchingWeights weights) {
        this.weights = weights;
    }

    public MatchBreakdown calculate(Lead lead, ServiceOffering service) {
        return calculate(lead, service, weights);
    }

    public MatchBreakdown calculate(Lead lead, ServiceOffering service, MatchingWeights weights) {
        double geographic = geographicMatch(lead.getCity(), lead.getState(), lead.getCountry(),
                service.getTargetLocations());
        double industry = industryMatch(lead.getIndustry(), service.getTargetIndustries());
        double need = needMatch(lead.getNeedsIdentified(), lead.getLeadCategory(),
                service.getServiceType(), service.getServiceCategory());
        double profile = profileMatch(lead.getType(), lead.getCompanySize(), lead.getRevenueRange(),
                service.getTargetAudience(), service.getTargetCompanySizes(), service.getRequirements());
        double behavioral = behavioralMatch(lead.getSignalStrength(), lead.getIntentScore(),
                lead.getSignals().size());

        double score = geographic * weights.geographic()
                + industry * weights.industry()
                + need * weights.need()
                + profile * weights.profile()
                + behavioral * weights.behavioral();
        score = Math.max(0, Math.min(100, score));

        ConfidenceLevel confidence = determineConfidence(score, geographic, industry, need, profile, behavioral);
        Priority priority = determinePriority(score, lead.getIntentScore());
        List<String> reasons = generateReasons(geographic, industry, need, profile, behavioral, lead);

        log.debug("Match scores for lead={} service={}: geographic={}, industry={}, need={}, profile={}, behavioral={}, total={}",
                lead.getId(), service.getId(), geographic, industry, need, profile, behavioral, score);

        return new MatchBreakdown(round(score), round(geographic), round(industry), round(need),
                round(profile), round(behavioral), confidence, priority, reasons);
    }

    /**
     * 100 without a location restriction or for nationwide services, 100 on city, 85 on state
     * (name or two-letter code), 70 on country, else 0. Locations match as whole words.
     */
    public double geographicMatch(String city, String state, String country, List<String> serviceLocations) {
        if (serviceLocations == null || serviceLocations.isEmpty()) {
            return 100;
        }
        List<String> locations = normalize(serviceLocations);
        if (locations.stream().anyMatch(NATIONWIDE::contains)) {
            return 100;
        }
        if (mentions(locations, city)) {
            return 100;
        }
        if (mentions(locations, state)
                || mentions(locations, StateAbbreviations.abbreviationOf(state).orElse(null))
                || mentions(locations, StateAbbreviations.nameOf(state).orElse(null))) {
            return 85;
        }
        if (mentions(locations, country)) {
            return 70;
        }
        return 0;
    }

    /**
     * 100 for unrestricted or exact, 80 for substring, 60 for a related family, else 30.
     * An unknown lead industry scores 50.
     */
    public double industryMatch(String leadIndustry, List<String> serviceIndustries) {
        if (serviceIndustries == null || serviceIndustries.isEmpty()) {
            return 100;
        }
        if (isBlank(leadIndustry)) {
            return 50;
        }
        String industry = leadIndustry.trim().toLowerCase(Locale.ROOT);
        List<String> targets = normalize(serviceIndustries);
        if (targets.stream().anyMatch(IndustryTaxonomy::isWildcard)) {
            return 100;
        }
        if (targets.contains(industry)) {
            return 100;
        }
        for (String target : targets) {
            if (target.contains(industry) || industry.contains(target)) {
                return 80;
            }
        }
        for (String target : targets) {
            if (IndustryTaxonomy.related(industry, target)) {
                return 60;
            }
        }
        return 30;
    }

    /**
     * Best of: need vs service type (100 substring, 80 related), lead vs service category
     * (90 equal, 70 related) and lead category vs service type (85 equal). Floor of 40.
     */
    public double needMatch(Collection<String> needs, String leadCategory, String serviceType, String serviceCategory) {
        double score = 0;
        if (needs != null && !isBlank(serviceType)) {
            String type = serviceType.toLowerCase(Locale.ROOT);
            for (String need : needs) {
                String n = need.toLowerCase(Locale.ROOT);
                if (type.contains(n) || n.contains(type)) {
                    score = Math.max(score, 100);
                } else if (NeedTaxonomy.needsRelated(n, type)) {
                    score = Math.max(score, 80);
                }
            }
        }
        if (!isBlank(leadCategory) && !isBlank(serviceCategory)) {
            if (leadCategory.equalsIgnoreCase(serviceCategory)) {
                score = Math.max(score, 90);
            } else if (NeedTaxonomy.categoriesRelated(leadCategory, serviceCategory)) {
                score = Math.max(score, 70);
            }
        }
        if (!isBlank(leadCategory) && !isBlank(serviceType) && leadCategory.equalsIgnoreCase(serviceType)) {
            score = Math.max(score, 85);
        }
        return score > 0 ? score : 40;
    }

    public double profileMatch(LeadType leadType, String companySize, String revenueRange,
                               TargetAudience audience, List<String> serviceCompanySizes,
                               Map<String, Object> requirements) {
        double score = 100;
        if (audience != null && leadType != null && !audience.accepts(leadType)) {
            score = Math.min(score, 30);
        }
        if (serviceCompanySizes != null && !serviceCompanySizes.isEmpty() && !isBlank(companySize)
                && !normalize(serviceCompanySizes).contains(companySize.trim().toLowerCase(Locale.ROOT))) {
            score = Math.min(score, 60);
        }
        // revenue ranges are free text, so a declared floor can only lower confidence
        if (requirements != null && isSet(requirements.get("min_revenue")) && !isBlank(revenueRange)) {
            score = Math.min(score, 80);
        }
        return score;
    }

    public double behavioralMatch(int signalStrength, int intentScore, int signalCount) {
        double score = signalStrength * 0.6 + intentScore * 0.4;
        if (signalCount > 0) {
            score = Math.min(100, score + Math.min(20, signalCount * 3));
        }
        return score;
    }

    static ConfidenceLevel determineConfidence(double score, double... components) {
        if (score >= 80) {
            for (double component : components) {
                if (component < 50) {
                    return ConfidenceLevel.MEDIUM;
                }
            }
            return ConfidenceLevel.HIGH;
        }
        return score >= 60 ? ConfidenceLevel.MEDIUM : ConfidenceLevel.LOW;
    }

    static Priority determinePriority(double score, int intentScore) {
        if (score >= 80 && intentScore >= 70) {
            return Priority.URGENT;
        }
        if (score >= 70) {
            return Priority.HIGH;
        }
        return score >= 50 ? Priority.MEDIUM : Priority.LOW;
    }

    private static List<String> generateReasons(double geographic, double industry, double need,
                                                double profile, double behavioral, Lead lead) {
        List<String> reasons = new ArrayList<>();
        if (geographic >= 85) {
            reasons.add("Strong geographic match: " + orEmpty(lead.getCity()) + ", " + orEmpty(lead.getState()));
        } else if (geographic >= 70) {
            reasons.add("Moderate geographic match");
        }
        if (industry >= 80) {
            reasons.add("Industry match: " + orEmpty(lead.getIndustry()));
        }
        if (need >= 80) {
            String needLabel = !isBlank(lead.getLeadCategory())
                    ? lead.getLeadCategory()
                    : String.join(", ", lead.getNeedsIdentified());
            reasons.add("Strong need match: " + needLabel);
        }
        if (profile >= 80) {
            reasons.add("Good profile fit");
        }
        if (behavioral >= 70) {
            reasons.add("High intent signals (score: " + lead.getIntentScore() + ")");
        }
        if (reasons.isEmpty()) {
            reasons.add("Potential match based on general criteria");
        }
        return reasons;
    }

    public MatchingWeights getWeights() {
        return weights;
    }

    private static boolean mentions(List<String> locations, String term) {
        if (isBlank(term)) {
            return false;
        }
        String needle = term.trim().toLowerCase(Locale.ROOT);
        return locations.stream().anyMatch(loc -> IndustryTaxonomy.containsTerm(loc, needle));
    }

    private static List<String> normalize(Collection<String> values) {
        return values.stream()
                .filter(v -> v != null)
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    private static boolean isSet(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        return !value.toString().isBlank();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String orEmpty(String value) {
        return Optional.ofNullable(value).orElse("");
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
