package com.rfidattendance.application.dto;

import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.Weekdays;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * DTO de un grupo con sus valores en texto.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupDto {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private Long id;
    private String name;
    private String category;
    private String level;
    private String weekday;
    private String startTime;

    public static GroupDto fromDomain(ClassGroup group) {
        return GroupDto.builder()
                .id(group.getId())
                .name(group.getName())
                .category(group.getCategory().getLabel())
                .level(group.getLevel().getLabel())
                .weekday(Weekdays.label(group.getWeekday()))
                .startTime(group.getStartTime().format(TIME_FORMAT))
                .build();
    }
}
