package io.seatwatch.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "shape", defaultImpl = CourseSpec.Grouped.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = CourseSpec.Grouped.class, name = "grouped"),
        @JsonSubTypes.Type(value = CourseSpec.Legacy.class, name = "legacy")
})
public sealed interface CourseSpec permits CourseSpec.Grouped, CourseSpec.Legacy {
    String department();

    String courseCode();

    List<SectionGroup> sectionGroups();

    default List<Target> toTargets() {
        List<Target> out = new ArrayList<>();
        for (SectionGroup group : sectionGroups()) {
            out.add(Target.lecture(department(), courseCode(), group.lecture()));
            for (String discussion : group.discussions()) {
                out.add(Target.discussion(department(), courseCode(), discussion));
            }
        }
        return out;
    }

    record Grouped(String department, String courseCode, List<SectionGroup> sections) implements CourseSpec {
        public Grouped {
            sections = sections == null ? List.of() : List.copyOf(sections);
        }

        @Override
        public List<SectionGroup> sectionGroups() {
            return sections;
        }
    }

    record Legacy(
            String department,
            String courseCode,
            String lectureSection,
            List<String> discussionSections
    ) implements CourseSpec {
        @Override
        public List<SectionGroup> sectionGroups() {
            return List.of(new SectionGroup(lectureSection, discussionSections));
        }
    }
}
