// ******************************************************************************
//
// Title:       X-Ray Lines.
// Description: X-Ray Lines - Reference Data for X-ray Spectroscopy.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2024.
//
// This file is part of X-Ray Lines.
//
// X-Ray Lines is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// X-Ray Lines is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// X-Ray Lines; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package xlines.descriptor;

import static java.lang.String.format;

import java.util.Arrays;

/**
 * The Reference class identifies a bibliographic source of property data.
 * <p>
 * The BibTeX key is required and is the handle used by reference priority lists. All other fields
 * are optional. Two references are equal only when every field is equal.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Reference implements Descriptor {
  private final String bibtexkey;
  private final String author;
  private final Integer year;
  private final String title;
  private final String type;
  private final String booktitle;
  private final String editor;
  private final String pages;
  private final String edition;
  private final String journal;
  private final String school;
  private final String address;
  private final String url;
  private final String note;
  private final String number;
  private final String series;
  private final String volume;
  private final String publisher;
  private final String organization;
  private final String chapter;
  private final String howpublished;
  private final String doi;

  private Reference(Builder builder) {
    this.bibtexkey = builder.bibtexkey;
    this.author = builder.author;
    this.year = builder.year;
    this.title = builder.title;
    this.type = builder.type;
    this.booktitle = builder.booktitle;
    this.editor = builder.editor;
    this.pages = builder.pages;
    this.edition = builder.edition;
    this.journal = builder.journal;
    this.school = builder.school;
    this.address = builder.address;
    this.url = builder.url;
    this.note = builder.note;
    this.number = builder.number;
    this.series = builder.series;
    this.volume = builder.volume;
    this.publisher = builder.publisher;
    this.organization = builder.organization;
    this.chapter = builder.chapter;
    this.howpublished = builder.howpublished;
    this.doi = builder.doi;
  }

  /**
   * Returns the interned Reference with only a BibTeX key.
   *
   * @param bibtexkey the BibTeX key.
   * @return the Reference.
   */
  public static Reference of(String bibtexkey) {
    return builder(bibtexkey).build();
  }

  /**
   * Create a new Builder.
   *
   * @param bibtexkey the BibTeX key.
   * @return a Builder.
   */
  public static Builder builder(String bibtexkey) {
    return new Builder(bibtexkey);
  }

  /**
   * Getter for the field <code>bibtexkey</code>.
   *
   * @return the BibTeX key.
   */
  public String getBibtexkey() {
    return bibtexkey;
  }

  public String getAuthor() {
    return author;
  }

  public Integer getYear() {
    return year;
  }

  public String getTitle() {
    return title;
  }

  public String getType() {
    return type;
  }

  public String getBooktitle() {
    return booktitle;
  }

  public String getEditor() {
    return editor;
  }

  public String getPages() {
    return pages;
  }

  public String getEdition() {
    return edition;
  }

  public String getJournal() {
    return journal;
  }

  public String getSchool() {
    return school;
  }

  public String getAddress() {
    return address;
  }

  public String getUrl() {
    return url;
  }

  public String getNote() {
    return note;
  }

  public String getNumber() {
    return number;
  }

  public String getSeries() {
    return series;
  }

  public String getVolume() {
    return volume;
  }

  public String getPublisher() {
    return publisher;
  }

  public String getOrganization() {
    return organization;
  }

  public String getChapter() {
    return chapter;
  }

  public String getHowpublished() {
    return howpublished;
  }

  public String getDoi() {
    return doi;
  }

  private Object[] fields() {
    return new Object[] {bibtexkey, author, year, title, type, booktitle, editor, pages,
        edition, journal, school, address, url, note, number, series, volume, publisher, organization,
        chapter, howpublished, doi};
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(fields(), ((Reference) o).fields());
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Arrays.hashCode(fields());
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("Reference(%s)", bibtexkey);
  }

  /** Builder for an interned Reference. */
  public static final class Builder {

    private String bibtexkey;
    private String author;
    private Integer year;
    private String title;
    private String type;
    private String booktitle;
    private String editor;
    private String pages;
    private String edition;
    private String journal;
    private String school;
    private String address;
    private String url;
    private String note;
    private String number;
    private String series;
    private String volume;
    private String publisher;
    private String organization;
    private String chapter;
    private String howpublished;
    private String doi;

    private Builder(String bibtexkey) {
      this.bibtexkey = bibtexkey;
    }

    public Builder author(String author) {
      this.author = author;
      return this;
    }

    public Builder year(Integer year) {
      this.year = year;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder booktitle(String booktitle) {
      this.booktitle = booktitle;
      return this;
    }

    public Builder editor(String editor) {
      this.editor = editor;
      return this;
    }

    public Builder pages(String pages) {
      this.pages = pages;
      return this;
    }

    public Builder edition(String edition) {
      this.edition = edition;
      return this;
    }

    public Builder journal(String journal) {
      this.journal = journal;
      return this;
    }

    public Builder school(String school) {
      this.school = school;
      return this;
    }

    public Builder address(String address) {
      this.address = address;
      return this;
    }

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder note(String note) {
      this.note = note;
      return this;
    }

    public Builder number(String number) {
      this.number = number;
      return this;
    }

    public Builder series(String series) {
      this.series = series;
      return this;
    }

    public Builder volume(String volume) {
      this.volume = volume;
      return this;
    }

    public Builder publisher(String publisher) {
      this.publisher = publisher;
      return this;
    }

    public Builder organization(String organization) {
      this.organization = organization;
      return this;
    }

    public Builder chapter(String chapter) {
      this.chapter = chapter;
      return this;
    }

    public Builder howpublished(String howpublished) {
      this.howpublished = howpublished;
      return this;
    }

    public Builder doi(String doi) {
      this.doi = doi;
      return this;
    }

    /**
     * Validate the fields and return the interned Reference.
     *
     * @return the Reference.
     * @throws InvalidDescriptorException if the BibTeX key is null or blank.
     */
    public Reference build() {
      return DescriptorCache.intern(Reference.class,
          new Object[] {bibtexkey, author, year, title, type, booktitle, editor, pages, edition,
              journal, school, address, url, note, number, series, volume, publisher, organization,
              chapter, howpublished, doi}, () -> {
            if (bibtexkey == null || bibtexkey.trim().isEmpty()) {
              throw new InvalidDescriptorException(Reference.class, bibtexkey,
                  "A BibTeX key must be defined");
            }
            return new Reference(this);
          });
    }
  }
}
