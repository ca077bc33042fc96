package com.acme.publisher.feed;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Minimal Atom feed document: title, id, updated and links.
 */
@JacksonXmlRootElement(localName = "feed", namespace = AtomFeed.ATOM_NS)
@JsonPropertyOrder({"title", "id", "updated", "links"})
public class AtomFeed {
    public static final String ATOM_NS = "http://www.w3.org/2005/Atom";

    @JacksonXmlProperty(localName = "title", namespace = ATOM_NS)
    private String title;

    @JacksonXmlProperty(localName = "id", namespace = ATOM_NS)
    private String id;

    @JacksonXmlProperty(localName = "updated", namespace = ATOM_NS)
    private String updated;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "link", namespace = ATOM_NS)
    private List<AtomLink> links = new ArrayList<>();

    public AtomFeed() {
    }

    public AtomFeed(String title, String id, String updated) {
        this.title = title;
        this.id = id;
        this.updated = updated;
    }

    public AtomFeed addLink(String rel, String href) {
        links.add(new AtomLink(rel, href));
        return this;
    }

    @JsonIgnore
    public Optional<String> link(String rel) {
        return links.stream().filter(l -> rel.equals(l.getRel())).map(AtomLink::getHref).findFirst();
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUpdated() {
        return updated;
    }

    public void setUpdated(String updated) {
        this.updated = updated;
    }

    public List<AtomLink> getLinks() {
        return links;
    }

    public void setLinks(List<AtomLink> links) {
        this.links = links;
    }
}
