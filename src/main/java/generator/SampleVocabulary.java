package generator;

import org.apache.commons.rng.UniformRandomProvider;

import static util.RandomSources.between;
import static util.RandomSources.pick;

/**
 * Words the sampled usernames, group topics and message bodies are built from.
 */
final class SampleVocabulary {

    static final String[] FIRST_NAMES = {
            "alex", "sam", "jordan", "taylor", "casey", "morgan", "riley", "avery", "jamie", "drew",
            "blake", "sage", "quinn", "rowan", "phoenix", "river", "skylar", "dakota", "cameron", "emery",
            "hayden", "kendall", "logan", "parker", "reese", "charlie", "finley", "harper", "indigo", "justice",
            "kai", "lane", "marley", "nova", "ocean", "peyton", "raven", "scout", "storm", "tate",
            "val", "wren", "zion", "aria", "brook", "cleo", "dani", "echo", "fern", "gray",
            "iris", "jade", "knox", "luna", "max", "noel", "onyx", "rain", "true", "vega",
            "west", "yale", "zen"
    };

    static final String[] LAST_PARTS = {
            "dev", "code", "tech", "pro", "user", "chat", "msg", "talk", "comm", "link",
            "net", "web", "app", "sys", "hub", "lab", "box", "bit", "byte", "data",
            "info", "core", "sync", "flow", "stream", "pulse", "wave", "spark", "bolt", "dash",
            "zoom", "ping", "echo", "beam", "glow", "nova", "star", "moon", "sun", "sky",
            "cloud", "storm", "wind"
    };

    static final String[] TEAM_TYPES = {"Team", "Squad", "Crew", "Group", "Circle", "Club", "Gang"};

    static final String[] PROJECTS = {"Alpha", "Beta", "Gamma", "Phoenix", "Storm", "Thunder", "Lightning", "Rocket"};

    static final String[] DEPARTMENTS = {
            "Engineering", "Design", "Marketing", "Sales", "Support", "DevOps", "QA", "Product"
    };

    static final String[] CASUAL_GROUPS = {
            "Coffee Chat", "Random", "General", "Watercooler", "Lunch Crew", "Gaming", "Music", "Books"
    };

    static final String[] MESSAGE_TEMPLATES = {
            "Hey everyone! How's it going?",
            "Just finished the meeting, here are the key points:",
            "Can someone help me with this issue?",
            "Great work on the latest update!",
            "I'll be out of office tomorrow",
            "Let's schedule a quick sync",
            "Thanks for the quick response",
            "Looking forward to the presentation",
            "The deployment went smoothly",
            "Anyone free for a coffee break?",
            "I've updated the documentation",
            "The test results look good",
            "We should discuss this further",
            "I'll send the details via email",
            "Perfect timing on that fix",
            "The client feedback was positive",
            "Let me know if you need anything",
            "I'm working on the new feature",
            "The performance improvements are noticeable",
            "Good catch on that bug!",
            "I'll review the code changes",
            "The integration is working well",
            "We're ahead of schedule",
            "I'll handle the deployment",
            "Thanks for the collaboration",
            "The design looks fantastic",
            "I've tested the new functionality",
            "Let's wrap up this sprint",
            "The metrics are looking positive",
            "I'll coordinate with the team"
    };

    private SampleVocabulary() {
    }

    static String username(UniformRandomProvider rng) {
        switch (rng.nextInt(5)) {
            case 0:
                return pick(rng, FIRST_NAMES);
            case 1:
                return pick(rng, FIRST_NAMES) + between(rng, 10, 99);
            case 2:
                return pick(rng, FIRST_NAMES) + "_" + pick(rng, LAST_PARTS);
            case 3:
                return pick(rng, FIRST_NAMES) + pick(rng, LAST_PARTS);
            default:
                return pick(rng, LAST_PARTS) + "_" + pick(rng, FIRST_NAMES);
        }
    }

    static String groupTopic(UniformRandomProvider rng) {
        switch (rng.nextInt(5)) {
            case 0:
                return pick(rng, PROJECTS) + " " + pick(rng, TEAM_TYPES);
            case 1:
                return pick(rng, DEPARTMENTS) + " " + pick(rng, TEAM_TYPES);
            case 2:
                return pick(rng, CASUAL_GROUPS);
            case 3:
                return "Project " + pick(rng, PROJECTS);
            default:
                return pick(rng, DEPARTMENTS) + " Discussion";
        }
    }

    static String messageBody(UniformRandomProvider rng) {
        return pick(rng, MESSAGE_TEMPLATES);
    }
}
