package com.dailyprojects.core.fallback;

import com.dailyprojects.core.model.DifficultyLevel;
import com.dailyprojects.core.model.ProjectDraft;
import com.dailyprojects.core.model.Technology;
import com.dailyprojects.core.model.TechnologyKind;

import java.util.List;

import static com.dailyprojects.core.model.DifficultyLevel.ADVANCED;
import static com.dailyprojects.core.model.DifficultyLevel.BEGINNER;
import static com.dailyprojects.core.model.DifficultyLevel.INTERMEDIATE;
import static com.dailyprojects.core.model.TechnologyKind.BACKEND;
import static com.dailyprojects.core.model.TechnologyKind.DATABASE;
import static com.dailyprojects.core.model.TechnologyKind.DEVOPS;
import static com.dailyprojects.core.model.TechnologyKind.FRONTEND;
import static com.dailyprojects.core.model.TechnologyKind.MOBILE;
import static com.dailyprojects.core.model.TechnologyKind.OTHER;

/**
 * Pre-authored project ideas served when the model cannot be reached.
 * Order matters: selection shuffles this list with a date-derived seed.
 */
public final class TemplateCatalog {

    private TemplateCatalog() {}

    public static final List<ProjectDraft> PROJECTS = List.of(
            draft("Todo List with Dark Mode",
                    "A task list with a modern interface, automatic dark mode and local persistence. "
                            + "A good first exercise in state management and storing data in the browser.",
                    BEGINNER, "1-2 days", "Web Application",
                    List.of(tech("React", FRONTEND, "Reusable components and hooks for local state"),
                            tech("localStorage", DATABASE, "Simple persistence without a backend")),
                    List.of("Add and remove tasks", "Dark mode toggle", "Filter by status",
                            "Local persistence", "Smooth animations")),
            draft("Weather Dashboard",
                    "A dashboard showing current conditions and forecasts for several cities, "
                            + "with interactive charts and automatic geolocation.",
                    INTERMEDIATE, "3-4 days", "Data Visualization",
                    List.of(tech("Vue.js", FRONTEND, "Reactive rendering for frequently refreshed data"),
                            tech("Chart.js", FRONTEND, "Interactive charts for temperature trends"),
                            tech("OpenWeather API", OTHER, "Reliable source of forecast data")),
                    List.of("Automatic geolocation", "City search", "Temperature charts",
                            "Five-day forecast", "Responsive layout")),
            draft("E-commerce Product Filter",
                    "A product catalog with real-time search and filters by category, price and rating, "
                            + "built to stay fast as the catalog grows.",
                    INTERMEDIATE, "4-5 days", "E-commerce",
                    List.of(tech("Next.js", FRONTEND, "Server-side rendering keeps listing pages fast"),
                            tech("MongoDB", DATABASE, "Flexible documents for products with varied attributes")),
                    List.of("Real-time search", "Combined filters", "Dynamic sorting",
                            "Infinite scrolling", "Favorites")),
            draft("Personal Finance Tracker",
                    "Track personal spending with automatic categorization, monthly budgets and visual reports "
                            + "that highlight where the money goes.",
                    ADVANCED, "1-2 weeks", "Finance",
                    List.of(tech("Spring Boot", BACKEND, "Typed REST API with validation for financial data"),
                            tech("PostgreSQL", DATABASE, "Transactional storage for money movements"),
                            tech("D3.js", FRONTEND, "Custom interactive visualizations")),
                    List.of("Automatic categorization", "Budgets with alerts", "Exportable reports",
                            "Recurring transactions", "Trend analysis")),
            draft("URL Shortener with Analytics",
                    "A link shortening service with a click analytics panel, per-link statistics "
                            + "and automatically generated QR codes.",
                    BEGINNER, "2-3 days", "Web Service",
                    List.of(tech("Node.js", BACKEND, "Lightweight server for a small HTTP service"),
                            tech("Redis", DATABASE, "Fast lookups for short codes and click counters")),
                    List.of("Custom aliases", "Click analytics", "QR code generation",
                            "Link expiration", "REST API")),
            draft("Recipe Finder with AI",
                    "Suggests recipes from the ingredients at hand, taking dietary restrictions and "
                            + "personal preferences into account.",
                    ADVANCED, "2-3 weeks", "AI Application",
                    List.of(tech("React", FRONTEND, "Rich search and filter interface"),
                            tech("OpenAI API", OTHER, "Suggestions and nutritional analysis"),
                            tech("Elasticsearch", DATABASE, "Full-text search over recipes"),
                            tech("Docker", DEVOPS, "Reproducible deployment of the search stack")),
                    List.of("Suggestions by ingredient", "Nutritional analysis", "Shopping list",
                            "Meal planner", "Personalized recommendations")),
            draft("Habit Streak Tracker",
                    "A mobile app for building daily habits with streaks, reminders and a calendar view "
                            + "that makes progress visible at a glance.",
                    BEGINNER, "2-3 days", "Mobile App",
                    List.of(tech("Flutter", MOBILE, "One codebase for Android and iOS"),
                            tech("SQLite", DATABASE, "On-device storage that works offline")),
                    List.of("Daily check-ins", "Streak counter", "Push reminders",
                            "Calendar heatmap", "Offline support")),
            draft("Markdown Knowledge Base",
                    "A personal wiki that stores notes as Markdown, links them together and finds "
                            + "anything through full-text search.",
                    INTERMEDIATE, "1 week", "Developer Tools",
                    List.of(tech("Svelte", FRONTEND, "Small, fast editor interface"),
                            tech("Go", BACKEND, "Single binary serving files and search"),
                            tech("Bleve", DATABASE, "Embedded full-text index")),
                    List.of("Live Markdown preview", "Backlinks between notes", "Full-text search",
                            "Tagging", "Export to HTML")),
            draft("CI Pipeline Visualizer",
                    "Reads build pipeline runs from a CI provider and shows duration trends, flaky steps "
                            + "and the slowest stages over time.",
                    ADVANCED, "2 weeks", "DevOps Tools",
                    List.of(tech("Kotlin", BACKEND, "Concise service for polling CI APIs"),
                            tech("TimescaleDB", DATABASE, "Time-series storage for run durations"),
                            tech("Grafana", DEVOPS, "Dashboards without building a UI from scratch")),
                    List.of("Pipeline import", "Duration trends", "Flaky step detection",
                            "Slowest stage ranking", "Slack alerts")),
            draft("Inbox Auto-Sorter",
                    "Connects to a mailbox over IMAP and files incoming mail into folders using "
                            + "user-defined rules and simple text classification.",
                    INTERMEDIATE, "4-5 days", "Automation Tools",
                    List.of(tech("Python", BACKEND, "Mature IMAP and text processing libraries"),
                            tech("scikit-learn", OTHER, "Lightweight classifier for unmatched mail")),
                    List.of("Rule editor", "IMAP sync", "Automatic classification",
                            "Dry-run mode", "Daily summary")),
            draft("Multiplayer Trivia Game",
                    "A real-time quiz game where players join a room with a code, answer timed questions "
                            + "and watch a live leaderboard.",
                    INTERMEDIATE, "1 week", "Games",
                    List.of(tech("TypeScript", FRONTEND, "Shared types between client and server"),
                            tech("Socket.IO", BACKEND, "Real-time rooms and events"),
                            tech("Redis", DATABASE, "Room state and leaderboards")),
                    List.of("Room codes", "Timed questions", "Live leaderboard",
                            "Custom question packs", "Spectator mode")),
            draft("Event-Driven Order Service",
                    "A set of microservices for placing, paying and shipping orders, coordinated through "
                            + "events with retries and a dead-letter queue.",
                    ADVANCED, "2-3 weeks", "APIs & Microservices",
                    List.of(tech("Spring Boot", BACKEND, "Production-ready services with little boilerplate"),
                            tech("Apache Kafka", BACKEND, "Durable event log between services"),
                            tech("PostgreSQL", DATABASE, "Per-service transactional storage"),
                            tech("Kubernetes", DEVOPS, "Deploying and scaling the services")),
                    List.of("Order saga", "Idempotent consumers", "Dead-letter queue",
                            "Distributed tracing", "OpenAPI documentation"))
    );

    private static ProjectDraft draft(String title, String description, DifficultyLevel difficulty,
                                      String estimatedTime, String category,
                                      List<Technology> technologies, List<String> features) {
        return new ProjectDraft(title, description, difficulty, estimatedTime, category, technologies, features);
    }

    private static Technology tech(String name, TechnologyKind kind, String reason) {
        return new Technology(name, kind, reason);
    }
}
