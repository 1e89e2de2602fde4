package com.example.contextrag.application.analysis;

import static com.example.contextrag.application.analysis.TopicCategory.FollowUp.about;
import static com.example.contextrag.application.analysis.TopicCategory.FollowUp.general;
import static com.example.contextrag.application.analysis.TopicCategory.words;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of topic categories. Earlier categories win ties during classification.
 */
public final class TopicCatalog {

    public static final String JOBS = "jobs";
    public static final String COURSES = "courses";
    public static final String CAMPUS = "campus";

    private final Map<String, TopicCategory> categories;

    public TopicCatalog(List<TopicCategory> categories) {
        Map<String, TopicCategory> m = new LinkedHashMap<>();
        for (TopicCategory c : categories) {
            if (m.putIfAbsent(c.name(), c) != null) {
                throw new IllegalArgumentException("duplicate category: " + c.name());
            }
        }
        this.categories = m;
    }

    public List<TopicCategory> categories() {
        return List.copyOf(categories.values());
    }

    public Optional<TopicCategory> find(String name) {
        return Optional.ofNullable(categories.get(name));
    }

    public static TopicCatalog defaultCatalog() {
        return new TopicCatalog(List.of(jobs(), courses(), campus()));
    }

    private static TopicCategory jobs() {
        ClarificationField location = ClarificationField.of(
                "job_location",
                "Are you looking for on-campus or off-campus job opportunities?",
                "This will help me provide more relevant job listings and advice",
                List.of("On-campus", "Off-campus", "Both", "Not sure"),
                "\\bon[- ]campus\\b", "\\boff[- ]campus\\b", "\\bremote\\b", "\\binternships?\\b",
                "\\bresearch\\b", "\\bfood service\\b");
        ClarificationField major = ClarificationField.of(
                "major",
                "What's your major or field of study?",
                "This helps me suggest jobs relevant to your field",
                List.of("Computer Science", "Engineering", "Business", "Arts", "Sciences", "Other"),
                "\\bcs\\b", "\\bcomputer science\\b", "\\bengineering\\b", "\\bbusiness\\b", "\\barts?\\b",
                "\\bsciences?\\b", "\\bnursing\\b", "\\bmajor(?:ing)? in\\b");

        return new TopicCategory(
                JOBS,
                words("jobs?", "work", "working", "employment", "careers?", "hiring", "internships?", "part[- ]time"),
                List.of(location, major),
                List.of(
                        about("major", "What's your major? This could help me suggest more relevant opportunities."),
                        about("job_location", "Are you looking for on-campus or off-campus positions?"),
                        general("What's your preferred work schedule (weekdays, weekends, evenings)?"),
                        general("Do you have any specific skills or experience you'd like to highlight?")
                ),
                List.of(
                        "Check the student jobs board daily",
                        "Contact your department's administrative office",
                        "Visit the Career Services office",
                        "Update your resume and cover letter",
                        "Network with professors and classmates"
                ),
                List.of(
                        "Career Services",
                        "Student Employment Office",
                        "Work+ Program",
                        "Internship Opportunities",
                        "Resume Building",
                        "General Career Fairs"
                )
        );
    }

    private static TopicCategory courses() {
        ClarificationField subject = ClarificationField.of(
                "course_subject",
                "What specific course or subject are you interested in?",
                "This helps me provide specific grade and professor information",
                List.of("Math courses", "Computer Science", "Engineering", "Business", "General Education", "Other"),
                "\\b[a-z]{2,4}\\s?\\d{3}\\b", "\\bmath\\b", "\\bcalculus\\b", "\\bcomputer science\\b",
                "\\bphysics\\b", "\\bchemistry\\b", "\\bbiology\\b", "\\bengineering\\b", "\\bbusiness\\b");

        return new TopicCategory(
                COURSES,
                words("courses?", "class(?:es)?", "grades?", "professors?", "gpa", "syllabus", "semester", "exams?"),
                List.of(subject),
                List.of(
                        general("What semester are you planning to take this course?"),
                        general("Are you more interested in professor ratings or grade distributions?"),
                        general("Do you want to know about specific sections or professors?"),
                        about("course_subject", "Which subject area should I focus on?")
                ),
                List.of(
                        "Check course registration dates",
                        "Review professor ratings",
                        "Talk to academic advisors",
                        "Join course-specific study groups",
                        "Review course syllabi and requirements"
                ),
                List.of(
                        "Course Registration Tips",
                        "Professor Selection Strategies",
                        "Grade Point Average (GPA) Information",
                        "Academic Advising",
                        "General Education Requirements"
                )
        );
    }

    private static TopicCategory campus() {
        ClarificationField which = ClarificationField.of(
                "campus",
                "Which campus are you referring to?",
                "To provide better information about campus locations",
                List.of("Tempe campus", "Downtown Phoenix", "Polytechnic campus", "West campus", "Online"),
                "\\btempe\\b", "\\bdowntown\\b", "\\bpoly(?:technic)?\\b", "\\bwest\\b", "\\bonline\\b");

        return new TopicCategory(
                CAMPUS,
                words("campus", "location", "where", "buildings?", "dorms?", "housing", "parking", "library"),
                List.of(which),
                List.of(
                        about("campus", "Which campus do you spend most of your time on?"),
                        general("Are you looking for something specific on campus?")
                ),
                List.of(
                        "Check the campus map for building locations",
                        "Visit the student services center",
                        "Look up shuttle and parking options"
                ),
                List.of(
                        "Campus Resources",
                        "Student Life",
                        "Campus Events",
                        "Student Organizations"
                )
        );
    }
}
