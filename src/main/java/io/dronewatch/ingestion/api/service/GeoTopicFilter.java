package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.FilterVerdict;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.util.KeywordMatcher;
import io.dronewatch.ingestion.config.BoundingBox;
import io.dronewatch.ingestion.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cheap rule-based screening: is the report about a drone, inside the covered region,
 * and describing something that happened rather than news about drones.
 * Ambiguous text passes and is left to the later stages.
 */
@Service
public class GeoTopicFilter {

    private static final Logger logger = LoggerFactory.getLogger(GeoTopicFilter.class);

    public static final String NOT_DRONE = "not_drone";
    public static final String OUTSIDE_BOUNDING_BOX = "outside_bounding_box";
    public static final String NO_IN_SCOPE_LOCATION = "no_in_scope_location";
    public static final String FOREIGN_INCIDENT = "foreign_incident";

    static final int TOPIC_REJECT_SCORE = 2;

    private static final KeywordMatcher DRONE_KEYWORDS = KeywordMatcher.of(List.of(
            "drone", "drones", "uav", "uavs", "uas", "quadcopter", "multicopter", "unmanned aircraft",
            "unmanned aerial vehicle", "dron", "drönare", "drönaren", "drönarna", "droner", "dronen", "dronerne", "dronene", "droneobservation", "droneaktivitet",
            "drohne", "drohnen", "lennokki", "lennokit", "drooni", "dronit"
    ));

    private static final KeywordMatcher INCIDENT_EVIDENCE = KeywordMatcher.of(List.of(
            "sighted", "sighting", "sightings", "observed", "spotted", "seen", "detected",
            "intrusion", "incursion", "closed", "closure", "shut", "suspended", "grounded",
            "halted", "disrupted", "disruption", "diverted", "evacuated", "hovering",
            "observeret", "observation", "opdaget", "spottet", "lukket", "lukkede", "indstillet",
            "observert", "oppdaget", "stengt", "stengte",
            "observerad", "observerade", "upptäckt", "upptäckte", "stängd", "stängdes", "sågs",
            "gesichtet", "gesperrt", "observé", "aperçu", "havaittu", "suljettu"
    ));

    private static final List<TopicRule> TOPIC_RULES = List.of(
            new TopicRule("policy",
                    KeywordMatcher.of(List.of(
                            "ban", "bans", "banned", "regulation", "regulations", "legislation", "law",
                            "rules", "restriction", "restrictions", "prohibited", "prohibition", "proposal",
                            "bill", "parliament", "minister", "forbud", "droneforbud", "regler", "lovgivning",
                            "lovforslag", "folketinget", "regelverk", "förbud", "drönarförbud", "lagstiftning",
                            "riksdagen", "verbot", "drohnenverbot", "gesetz", "interdiction", "réglementation")),
                    List.of(
                            Pattern.compile("\\b(ban\\w*|restrict\\w*|prohibit\\w*|regulat\\w*)\\b.{0,40}\\bdrones?\\b"),
                            Pattern.compile("\\bdrones?\\b.{0,40}\\b(bans?|restrictions?|regulations?|legislation|laws?)\\b"),
                            Pattern.compile("\\b(announc\\w*|introduc\\w*|propos\\w*|adopt\\w*|pass(es|ed)?|approv\\w*)\\b.{0,60}\\b(bans?|laws?|legislation|regulations?|rules)\\b"),
                            Pattern.compile("\\b(forbud|förbud|verbot)\\b.{0,30}\\b(droner?|drönare|drohnen)\\b"),
                            Pattern.compile("\\bno[- ]fly[- ]zones?\\b.{0,40}\\b(introduc\\w*|announc\\w*|extend\\w*|new)\\b"))),
            new TopicRule("defense",
                    KeywordMatcher.of(List.of(
                            "deploy", "deploys", "deployed", "deployment", "troops", "soldiers", "frigate",
                            "frigates", "warship", "reinforcements", "procurement", "purchase", "contract",
                            "anti-drone", "counter-drone", "air defence", "air defense", "radar systems",
                            "udsender", "indsætter", "fregat", "sender soldater", "utplasserer", "sätter in",
                            "luftvärn", "luftforsvar")),
                    List.of(
                            Pattern.compile("\\b(deploy\\w*|send(s|ing)?|sent|mov(e|es|ed|ing)|station(s|ed)?|transfer\\w*)\\b.{0,60}\\b(troops|soldiers|frigates?|warships?|jets|fighters|air[- ]defen[cs]e|anti[- ]drone|counter[- ]drone|radars?|systems?)\\b"),
                            Pattern.compile("\\b(buy|buys|bought|purchas\\w*|procur\\w*|order(s|ed)?|invest\\w*)\\b.{0,60}\\b(anti[- ]drone|counter[- ]drone|drone[- ]defen[cs]e|drones|interceptors?)\\b"))),
            new TopicRule("exercise",
                    KeywordMatcher.of(List.of(
                            "exercise", "drill", "drills", "training", "simulation", "simulated", "rehearsal",
                            "mock", "øvelse", "øvelsen", "militærøvelse", "øving", "övning", "övningen",
                            "übung", "manöver", "exercice", "harjoitus")),
                    List.of(
                            Pattern.compile("\\b(military|nato|joint|planned|annual|large[- ]scale)\\s+(exercises?|drills?)\\b"),
                            Pattern.compile("\\bas part of (an? |the )?(exercise|drill|training)\\b"))),
            new TopicRule("discussion",
                    KeywordMatcher.of(List.of(
                            "opinion", "debate", "analysis", "editorial", "commentary", "podcast", "interview",
                            "column", "kronik", "debat", "analyse", "kommentar", "ledare", "leder")),
                    List.of(
                            Pattern.compile("\\b(experts?|analysts?|researchers?)\\b.{0,40}\\b(warn\\w*|discuss\\w*|debat\\w*|explain\\w*)\\b"),
                            Pattern.compile("\\b(what|how|why)\\b.{0,40}\\bdrones?\\b.{0,40}\\b(means?|explained|matters?)\\b")))
    );

    private final BoundingBox boundingBox;

    public GeoTopicFilter(PipelineConfig config) {
        this.boundingBox = config.geo() != null && config.geo().boundingBox() != null
                ? config.geo().boundingBox()
                : BoundingBox.europe();
    }

    public FilterVerdict filter(IncidentCandidate candidate) {
        String text = candidate.fullText();

        if (!DRONE_KEYWORDS.matches(text)) {
            return reject(candidate, NOT_DRONE);
        }

        boolean placeMatch = Gazetteer.IN_SCOPE.matches(text);

        if (candidate.hasCoordinates()) {
            if (!boundingBox.contains(candidate.latitude(), candidate.longitude())) {
                return reject(candidate, OUTSIDE_BOUNDING_BOX);
            }
        } else if (!placeMatch) {
            return reject(candidate, NO_IN_SCOPE_LOCATION);
        }

        if (!placeMatch && Gazetteer.FOREIGN.matches(text) && !Gazetteer.CONTEXT.matches(text)) {
            return reject(candidate, FOREIGN_INCIDENT);
        }

        String lowerText = text.toLowerCase(Locale.ROOT);
        int incidentHits = INCIDENT_EVIDENCE.findIn(lowerText).size();

        TopicRule best = null;
        int bestScore = 0;
        for (TopicRule rule : TOPIC_RULES) {
            int score = rule.score(lowerText) - 2 * incidentHits;
            if (score > bestScore) {
                best = rule;
                bestScore = score;
            }
        }

        if (best != null && bestScore >= TOPIC_REJECT_SCORE) {
            logger.debug("Topic '{}' scored {} (incident evidence {}) for '{}'",
                    best.category(), bestScore, incidentHits, candidate.title());
            return reject(candidate, best.category());
        }

        return FilterVerdict.accept(candidate.hasCoordinates() ? "in_bounding_box" : "gazetteer_match");
    }

    private FilterVerdict reject(IncidentCandidate candidate, String reason) {
        logger.debug("Filter rejected '{}': {}", candidate.title(), reason);
        return FilterVerdict.reject(reason);
    }

    private record TopicRule(String category, KeywordMatcher keywords, List<Pattern> phrases) {

        int score(String lowerText) {
            Set<String> hits = keywords.findIn(lowerText);
            long phraseHits = phrases.stream().filter(p -> p.matcher(lowerText).find()).count();
            return hits.size() + 2 * (int) phraseHits;
        }
    }
}
