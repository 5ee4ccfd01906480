package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.util.KeywordMatcher;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Place-name vocabularies for the covered region (Nordics, UK, Ireland, western and central
 * Europe, Baltics) and for regions that must never be ingested.
 * <p>
 * In-scope places lie inside the default bounding box. Names that double as ordinary words
 * (nice, cork, polish, essen) and nationality adjectives are left out; a text-only report has to
 * name a place or a country.
 */
final class Gazetteer {

    static final Set<String> IN_SCOPE_PLACES = Set.of(
            // Denmark
            "copenhagen", "københavn", "aarhus", "odense", "aalborg", "esbjerg", "roskilde",
            "kastrup", "billund", "karup", "skrydstrup", "bornholm", "rønne", "korsør", "kalundborg", "jylland",
            // Norway
            "oslo", "bergen", "trondheim", "stavanger", "tromsø", "drammen", "kristiansand",
            "bodø", "gardermoen", "ålesund", "ørland", "rygge",
            // Sweden
            "stockholm", "göteborg", "gothenburg", "malmö", "uppsala", "linköping", "örebro",
            "helsingborg", "arlanda", "bromma", "karlskrona", "ringhals", "forsmark",
            // Finland
            "helsinki", "espoo", "tampere", "vantaa", "oulu", "turku", "jyväskylä", "lahti", "kuopio",
            // UK and Ireland
            "london", "manchester", "birmingham", "edinburgh", "glasgow", "liverpool", "bristol",
            "gatwick", "heathrow", "stansted", "luton", "belfast", "cardiff",
            "dublin", "galway", "limerick", "shannon airport",
            // Germany
            "berlin", "munich", "münchen", "frankfurt", "hamburg", "cologne", "köln", "düsseldorf",
            "stuttgart", "dortmund", "leipzig", "dresden", "nuremberg", "bremen", "kiel",
            // Poland
            "warsaw", "warszawa", "krakow", "kraków", "gdansk", "gdańsk", "wroclaw", "wrocław",
            "poznan", "poznań", "lublin", "szczecin", "rzeszów", "rzeszow",
            // France, Benelux
            "paris", "lyon", "marseille", "toulouse", "nantes", "strasbourg", "bordeaux",
            "orly", "charles de gaulle",
            "brussels", "bruxelles", "brussel", "antwerp", "antwerpen", "ghent", "liège", "bruges",
            "amsterdam", "rotterdam", "the hague", "den haag", "utrecht", "eindhoven", "schiphol", "groningen",
            // Southern Europe
            "madrid", "barcelona", "valencia", "seville", "sevilla", "malaga", "málaga", "bilbao", "palma de mallorca",
            "rome", "milan", "milano", "naples", "napoli", "turin", "torino", "venice", "bologna",
            "lisbon", "lisboa", "porto",
            // Central Europe, Baltics
            "vienna", "wien", "salzburg", "innsbruck", "graz",
            "zurich", "zürich", "geneva", "genève", "basel", "bern", "lausanne",
            "prague", "praha", "brno",
            "tallinn", "riga", "vilnius", "tartu", "kaunas", "klaipeda"
    );

    static final Set<String> IN_SCOPE_COUNTRIES = Set.of(
            "denmark", "danmark", "dansk", "danske",
            "norway", "norge", "norsk", "norske",
            "sweden", "sverige", "svensk", "svenska",
            "finland", "suomi",
            "united kingdom", "britain", "england", "scotland", "wales",
            "ireland",
            "germany", "deutschland",
            "poland", "polska",
            "france",
            "belgium", "belgië", "belgique",
            "netherlands", "nederland",
            "luxembourg",
            "spain", "españa",
            "portugal",
            "italy", "italia",
            "austria", "österreich",
            "switzerland", "schweiz", "suisse",
            "czech republic", "czechia",
            "estonia", "eesti", "latvia", "latvija", "lithuania", "lietuva"
    );

    static final Set<String> FOREIGN_REGIONS = Set.of(
            // war zones
            "ukraina", "ukraine", "ukrainsk", "ukrainian", "kiev", "kyiv", "odesa", "kharkiv", "lviv",
            "russia", "rusland", "russisk", "russian", "moscow", "moskva",
            "belarus", "hviderusland", "belarusian", "minsk",
            // Middle East
            "israel", "gaza", "tel aviv", "jerusalem", "iran", "tehran", "syria", "damascus",
            "iraq", "baghdad", "yemen", "lebanon", "saudi",
            // Asia
            "china", "beijing", "shanghai", "japan", "tokyo", "korea", "seoul", "taiwan",
            "india", "delhi", "mumbai", "pakistan", "afghanistan",
            // Africa
            "egypt", "cairo", "johannesburg", "nairobi", "nigeria",
            // Americas
            "united states", "usa", "washington", "new york", "canada", "mexico"
    );

    /**
     * Phrases marking a European response to events elsewhere.
     */
    static final List<String> EUROPEAN_CONTEXT = List.of(
            "denmark responds", "norwegian authorities", "swedish defense", "finnish government",
            "nordic countries", "nordic ministers", "nordic leaders", "scandinavian countries",
            "eu responds", "european union", "european authorities", "nato allies", "nato responds"
    );

    static final KeywordMatcher IN_SCOPE = KeywordMatcher.of(union(IN_SCOPE_PLACES, IN_SCOPE_COUNTRIES));
    static final KeywordMatcher FOREIGN = KeywordMatcher.of(FOREIGN_REGIONS);
    static final KeywordMatcher CONTEXT = KeywordMatcher.of(EUROPEAN_CONTEXT);

    private Gazetteer() {
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        var all = new HashSet<String>(first);
        all.addAll(second);
        return all;
    }
}
