package com.ns.funnel.config;

import java.util.List;

/**
 * Names of the tables and columns of the event store the plans are written against.
 */
public class EventStoreDefinition {
    private String eventsTable = "events";
    private String personsTable = "persons";
    private String personsIdColumn = "id";
    private String timestampColumn = "timestamp";
    private String eventColumn = "event";
    private String uuidColumn = "uuid";
    private String personIdColumn = "person_id";
    private String propertiesColumn = "properties";
    private List<String> personPropertiesChain = List.of("person", "properties");
    private String groupColumnPrefix = "$group_";
    private String sessionIdProperty = "$session_id";
    private String windowIdProperty = "$window_id";

    // Getters and Setters
    public String getEventsTable() { return eventsTable; }
    public void setEventsTable(String eventsTable) { this.eventsTable = eventsTable; }
    public String getPersonsTable() { return personsTable; }
    public void setPersonsTable(String personsTable) { this.personsTable = personsTable; }
    public String getPersonsIdColumn() { return personsIdColumn; }
    public void setPersonsIdColumn(String personsIdColumn) { this.personsIdColumn = personsIdColumn; }
    public String getTimestampColumn() { return timestampColumn; }
    public void setTimestampColumn(String timestampColumn) { this.timestampColumn = timestampColumn; }
    public String getEventColumn() { return eventColumn; }
    public void setEventColumn(String eventColumn) { this.eventColumn = eventColumn; }
    public String getUuidColumn() { return uuidColumn; }
    public void setUuidColumn(String uuidColumn) { this.uuidColumn = uuidColumn; }
    public String getPersonIdColumn() { return personIdColumn; }
    public void setPersonIdColumn(String personIdColumn) { this.personIdColumn = personIdColumn; }
    public String getPropertiesColumn() { return propertiesColumn; }
    public void setPropertiesColumn(String propertiesColumn) { this.propertiesColumn = propertiesColumn; }
    public List<String> getPersonPropertiesChain() { return personPropertiesChain; }
    public void setPersonPropertiesChain(List<String> personPropertiesChain) { this.personPropertiesChain = personPropertiesChain; }
    public String getGroupColumnPrefix() { return groupColumnPrefix; }
    public void setGroupColumnPrefix(String groupColumnPrefix) { this.groupColumnPrefix = groupColumnPrefix; }
    public String getSessionIdProperty() { return sessionIdProperty; }
    public void setSessionIdProperty(String sessionIdProperty) { this.sessionIdProperty = sessionIdProperty; }
    public String getWindowIdProperty() { return windowIdProperty; }
    public void setWindowIdProperty(String windowIdProperty) { this.windowIdProperty = windowIdProperty; }

    @Override
    public String toString() {
        return "EventStore: events=" + eventsTable + ", persons=" + personsTable;
    }
}
